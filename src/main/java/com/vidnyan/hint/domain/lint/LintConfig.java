package com.vidnyan.hint.domain.lint;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Options controlling which rules run and how they judge names.
 * Immutable value object; safe to share between concurrently linted files.
 */
@Value
@Builder(toBuilder = true)
public class LintConfig {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.8;

    public static final Set<String> DEFAULT_INITIALISMS = Set.of(
            "ACL", "API", "ASCII", "CPU", "CSS", "DNS", "EOF", "GUID", "HTML", "HTTP", "HTTPS", "ID",
            "IP", "JSON", "LHS", "QPS", "RAM", "RHS", "RPC", "SLA", "SMTP", "SQL", "SSH", "TCP",
            "TLS", "TTL", "UDP", "UI", "UID", "UUID", "URI", "URL", "UTF8", "VM", "XML", "XMPP",
            "XSRF", "XSS");

    public static final Set<String> DEFAULT_DISALLOWED_RECEIVER_NAMES = Set.of("me", "this", "self");

    @Builder.Default
    double minConfidence = DEFAULT_MIN_CONFIDENCE;
    @Builder.Default
    boolean packageComments = true;
    @Builder.Default
    boolean imports = true;
    @Builder.Default
    boolean exported = true;
    @Builder.Default
    boolean allowPackagePrefixInNames = false;
    @Builder.Default
    boolean naming = true;
    @Builder.Default
    boolean flagUnderscoreInPackageName = true;
    @Builder.Default
    boolean varDecls = true;
    @Builder.Default
    boolean elses = true;
    @Builder.Default
    boolean rangeLoops = true;
    @Builder.Default
    boolean errorChecks = true;
    @Builder.Default
    boolean receiverNames = true;
    @Builder.Default
    boolean incDec = true;
    @Builder.Default
    boolean makeSlice = true;
    @Builder.Default
    boolean errorReturn = true;
    @Builder.Default
    boolean ignoredReturn = true;
    @Builder.Default
    boolean namedReturn = true;
    @Builder.Default
    boolean useFixedReceiverName = false;
    @Builder.Default
    String fixedReceiverName = "this";
    @Builder.Default
    Set<String> disallowedReceiverNames = DEFAULT_DISALLOWED_RECEIVER_NAMES;
    // Upper case, whatever case they were configured in.
    @Builder.Default
    Set<String> initialisms = DEFAULT_INITIALISMS;

    public LintConfig(double minConfidence, boolean packageComments, boolean imports, boolean exported,
                      boolean allowPackagePrefixInNames, boolean naming, boolean flagUnderscoreInPackageName,
                      boolean varDecls, boolean elses, boolean rangeLoops, boolean errorChecks,
                      boolean receiverNames, boolean incDec, boolean makeSlice, boolean errorReturn,
                      boolean ignoredReturn, boolean namedReturn, boolean useFixedReceiverName,
                      String fixedReceiverName, Set<String> disallowedReceiverNames, Set<String> initialisms) {
        if (minConfidence < 0 || minConfidence > 1) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1]: " + minConfidence);
        }
        this.minConfidence = minConfidence;
        this.packageComments = packageComments;
        this.imports = imports;
        this.exported = exported;
        this.allowPackagePrefixInNames = allowPackagePrefixInNames;
        this.naming = naming;
        this.flagUnderscoreInPackageName = flagUnderscoreInPackageName;
        this.varDecls = varDecls;
        this.elses = elses;
        this.rangeLoops = rangeLoops;
        this.errorChecks = errorChecks;
        this.receiverNames = receiverNames;
        this.incDec = incDec;
        this.makeSlice = makeSlice;
        this.errorReturn = errorReturn;
        this.ignoredReturn = ignoredReturn;
        this.namedReturn = namedReturn;
        this.useFixedReceiverName = useFixedReceiverName;
        this.fixedReceiverName = fixedReceiverName;
        this.disallowedReceiverNames = Set.copyOf(disallowedReceiverNames);
        this.initialisms = canonical(initialisms);
    }

    public static LintConfig defaults() {
        return builder().build();
    }

    private static Set<String> canonical(Collection<String> words) {
        Set<String> out = new LinkedHashSet<>();
        for (String w : words) {
            out.add(w.toUpperCase(Locale.ROOT));
        }
        return Set.copyOf(out);
    }

    public static class LintConfigBuilder {

        /**
         * Turns every rule group off, leaving thresholds and name sets untouched.
         */
        public LintConfigBuilder noRules() {
            return packageComments(false)
                    .imports(false)
                    .exported(false)
                    .naming(false)
                    .varDecls(false)
                    .elses(false)
                    .rangeLoops(false)
                    .errorChecks(false)
                    .receiverNames(false)
                    .incDec(false)
                    .makeSlice(false)
                    .errorReturn(false)
                    .ignoredReturn(false)
                    .namedReturn(false);
        }
    }
}
