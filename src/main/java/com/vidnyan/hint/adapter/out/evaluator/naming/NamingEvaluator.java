package com.vidnyan.hint.adapter.out.evaluator.naming;

import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.ast.Decl.GenDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Field;
import com.vidnyan.hint.domain.ast.FieldList;
import com.vidnyan.hint.domain.ast.Spec;
import com.vidnyan.hint.domain.ast.Stmt.AssignStmt;
import com.vidnyan.hint.domain.ast.Stmt.RangeStmt;
import com.vidnyan.hint.domain.ast.Token;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.lint.StyleGuide;
import com.vidnyan.hint.domain.naming.NameNormalizer;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks every declared name for underscores, ALL_CAPS, a leading k, and miscased initialisms.
 */
@Component
@Order(40)
public class NamingEvaluator implements RuleEvaluator {

    private static final Pattern ALL_CAPS = Pattern.compile("^[A-Z0-9_]+$");

    private static final List<String> TEST_FUNC_PREFIXES = List.of("Example", "Test", "Benchmark");

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isNaming();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        String pkg = file.packageName();
        if (file.getConfig().isFlagUnderscoreInPackageName() && pkg.contains("_") && !pkg.endsWith("_test")) {
            problems.report(file.getTree(), 1, StyleGuide.EFFECTIVE_GO_PACKAGE_NAMES, Category.NAMING,
                    "don't use an underscore in package name");
        }

        NameCheck check = new NameCheck(file, problems);
        file.walk(node -> {
            if (node instanceof AssignStmt as) {
                if (as.tok() != Token.DEFINE) {
                    return true;
                }
                for (Expr e : as.lhs()) {
                    if (e instanceof Expr.Ident id) {
                        check.check(id, "var");
                    }
                }
            } else if (node instanceof FuncDecl fn) {
                if (file.isTest() && isTestFunction(fn.name().name())) {
                    return true;
                }
                check.check(fn.name(), "func");
                String thing = fn.isMethod() ? "method" : "func";
                check.checkList(fn.type().params(), thing + " parameter");
                check.checkList(fn.type().results(), thing + " result");
            } else if (node instanceof GenDecl gen) {
                if (gen.tok() == Token.IMPORT) {
                    return true;
                }
                String thing = gen.tok().text();
                for (Spec spec : gen.specs()) {
                    if (spec instanceof Spec.TypeSpec ts) {
                        check.check(ts.name(), thing);
                    } else if (spec instanceof Spec.ValueSpec vs) {
                        vs.names().forEach(id -> check.check(id, thing));
                    }
                }
            } else if (node instanceof Expr.InterfaceType it) {
                // Interface method names are often constrained by the concrete types; only check their signatures.
                for (Field method : it.methods().list()) {
                    if (method.type() instanceof Expr.FuncType ft) {
                        check.checkList(ft.params(), "interface method parameter");
                        check.checkList(ft.results(), "interface method result");
                    }
                }
            } else if (node instanceof RangeStmt rs) {
                if (rs.tok() != Token.DEFINE) {
                    return true;
                }
                if (rs.key() instanceof Expr.Ident id) {
                    check.check(id, "range var");
                }
                if (rs.value() instanceof Expr.Ident id) {
                    check.check(id, "range var");
                }
            } else if (node instanceof Expr.StructType st) {
                for (Field f : st.fields().list()) {
                    f.names().forEach(id -> check.check(id, "struct field"));
                }
            }
            return true;
        });
    }

    private static boolean isTestFunction(String name) {
        return TEST_FUNC_PREFIXES.stream().anyMatch(name::startsWith);
    }

    /**
     * Checks a single identifier. The ALL_CAPS and leading-k checks run before normalization and
     * in this order; ALL_CAPS ends the check, a leading k does not.
     */
    private static final class NameCheck {
        private final FileContext file;
        private final ProblemCollector problems;

        NameCheck(FileContext file, ProblemCollector problems) {
            this.file = file;
            this.problems = problems;
        }

        void check(Expr.Ident id, String thing) {
            String name = id.name();
            if (id.isBlank()) {
                return;
            }

            // Two common styles from other languages that don't belong in Go.
            if (name.length() >= 5 && ALL_CAPS.matcher(name).matches() && name.contains("_")) {
                problems.report(id, 0.6, StyleGuide.MIXED_CAPS, Category.NAMING,
                        "don't use ALL_CAPS in Go names; use CamelCase");
                return;
            }
            if (name.length() > 2 && name.charAt(0) == 'k' && name.charAt(1) >= 'A' && name.charAt(1) <= 'Z') {
                String should = Character.toLowerCase(name.charAt(1)) + name.substring(2);
                problems.report(id, 0.6, StyleGuide.MIXED_CAPS, Category.NAMING,
                        "don't use leading k in Go names; %s %s should be %s", thing, name, should);
            }

            String should = NameNormalizer.normalize(name, file.getConfig().getInitialisms());
            if (name.equals(should)) {
                return;
            }
            if (name.length() > 2 && name.substring(1).contains("_")) {
                problems.report(id, 0.8, StyleGuide.EFFECTIVE_GO_MIXED_CAPS, Category.NAMING,
                        "don't use underscores in Go names; %s %s should be %s", thing, name, should);
                return;
            }
            problems.report(id, 0.8, StyleGuide.INITIALISMS, Category.NAMING,
                    "%s %s should be %s", thing, name, should);
        }

        void checkList(FieldList fields, String thing) {
            if (fields == null) {
                return;
            }
            for (Field f : fields.list()) {
                f.names().forEach(id -> check(id, thing));
            }
        }
    }
}
