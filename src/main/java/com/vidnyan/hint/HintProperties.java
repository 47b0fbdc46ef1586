package com.vidnyan.hint;

import com.vidnyan.hint.domain.lint.LintConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Configuration properties for the linter.
 * Can be configured via application.yml or command line arguments (--hint.lint.min-confidence=0.5).
 */
@Data
@Component
@ConfigurationProperties(prefix = "hint.lint")
public class HintProperties {

    /**
     * Files or directories to lint; directories are searched recursively for .go files.
     */
    private List<String> paths = new ArrayList<>();

    /**
     * Optional JSON file whose settings override the ones below.
     */
    private String configFile;

    private double minConfidence = LintConfig.DEFAULT_MIN_CONFIDENCE;

    private boolean packageComments = true;
    private boolean imports = true;
    private boolean exported = true;
    private boolean allowPackagePrefixInNames = false;
    private boolean naming = true;
    private boolean flagUnderscoreInPackageName = true;
    private boolean varDecls = true;
    private boolean elses = true;
    private boolean rangeLoops = true;
    private boolean errorChecks = true;
    private boolean receiverNames = true;
    private boolean incDec = true;
    private boolean makeSlice = true;
    private boolean errorReturn = true;
    private boolean ignoredReturn = true;
    private boolean namedReturn = true;

    private boolean useFixedReceiverName = false;
    private String fixedReceiverName = "this";

    private List<String> disallowedReceiverNames = new ArrayList<>(LintConfig.DEFAULT_DISALLOWED_RECEIVER_NAMES);

    /**
     * Words whose case must be kept uniform in names, e.g. URL or ID.
     */
    private List<String> initialisms = new ArrayList<>(LintConfig.DEFAULT_INITIALISMS);

    public LintConfig toLintConfig() {
        return LintConfig.builder()
                .minConfidence(minConfidence)
                .packageComments(packageComments)
                .imports(imports)
                .exported(exported)
                .allowPackagePrefixInNames(allowPackagePrefixInNames)
                .naming(naming)
                .flagUnderscoreInPackageName(flagUnderscoreInPackageName)
                .varDecls(varDecls)
                .elses(elses)
                .rangeLoops(rangeLoops)
                .errorChecks(errorChecks)
                .receiverNames(receiverNames)
                .incDec(incDec)
                .makeSlice(makeSlice)
                .errorReturn(errorReturn)
                .ignoredReturn(ignoredReturn)
                .namedReturn(namedReturn)
                .useFixedReceiverName(useFixedReceiverName)
                .fixedReceiverName(fixedReceiverName)
                .disallowedReceiverNames(new LinkedHashSet<>(disallowedReceiverNames))
                .initialisms(new LinkedHashSet<>(initialisms))
                .build();
    }
}
