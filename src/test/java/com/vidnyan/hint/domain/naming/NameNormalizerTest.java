package com.vidnyan.hint.domain.naming;

import com.vidnyan.hint.domain.lint.LintConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NameNormalizerTest {

    private static final Set<String> INITIALISMS = LintConfig.DEFAULT_INITIALISMS;

    private static String normalize(String name) {
        return NameNormalizer.normalize(name, INITIALISMS);
    }

    @Test
    void normalize_ShouldLeaveConventionalNamesAlone() {
        assertEquals("_", normalize("_"));
        assertEquals("url", normalize("url"));
        assertEquals("fooBar", normalize("fooBar"));
        assertEquals("HTTPServer", normalize("HTTPServer"));
        assertEquals("urlParser", normalize("urlParser"));
    }

    @Test
    void normalize_ShouldRemoveUnderscores() {
        assertEquals("fooBar", normalize("foo_bar"));
        assertEquals("fooBar", normalize("foo__bar"));
        assertEquals("myParam", normalize("my_param"));
    }

    @Test
    void normalize_ShouldUpperCaseInitialisms() {
        assertEquals("fooID", normalize("fooId"));
        assertEquals("getURL", normalize("getUrl"));
        assertEquals("getURL", normalize("get_url"));
        assertEquals("URL", normalize("Url"));
        assertEquals("IDFoo", normalize("IdFoo"));
    }

    @Test
    void normalize_ShouldKeepLeadingInitialismLowerCaseInUnexportedNames() {
        assertEquals("jsonAPI", normalize("json_api"));
        assertEquals("idToken", normalize("id_token"));
    }

    @Test
    void normalize_ShouldUseConfiguredInitialisms() {
        Set<String> custom = Set.of("GRPC");
        assertEquals("newGRPCClient", NameNormalizer.normalize("newGrpcClient", custom));
        assertEquals("getUrl", NameNormalizer.normalize("getUrl", custom));
    }

    @Test
    void normalize_ShouldReachFixedPointWhenUnderscoreRemovalFormsInitialism() {
        assertEquals("URL", normalize("U_rl_"));
        assertEquals("URIXiK", normalize("U_RiXiK"));
        assertEquals("rURI1x", normalize("rU_ri1x"));
    }

    @Test
    void normalize_ShouldBeIdempotentForGeneratedNames() {
        for (String name : generatedNames()) {
            String once = normalize(name);
            assertEquals(once, normalize(once), name);
        }
    }

    @Test
    void normalize_ShouldPreserveCaseOfFirstLetterForGeneratedNames() {
        for (String name : generatedNames()) {
            String result = normalize(name);
            assertEquals(Character.isUpperCase(name.charAt(0)), Character.isUpperCase(result.charAt(0)), name);
        }
    }

    /**
     * Identifiers built from letters that spell initialisms, underscores and digits.
     */
    private static List<String> generatedNames() {
        String letters = "aAbBdDiIlLpPrRsStTuUxXkK";
        String rest = letters + "__01";
        Random random = new Random(20240611L);
        List<String> names = new ArrayList<>();
        for (int n = 0; n < 5000; n++) {
            StringBuilder sb = new StringBuilder();
            sb.append(letters.charAt(random.nextInt(letters.length())));
            int length = random.nextInt(12);
            for (int i = 0; i < length; i++) {
                sb.append(rest.charAt(random.nextInt(rest.length())));
            }
            names.add(sb.toString());
        }
        return names;
    }
}
