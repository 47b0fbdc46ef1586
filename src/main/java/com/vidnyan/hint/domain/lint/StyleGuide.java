package com.vidnyan.hint.domain.lint;

/**
 * Reference links attached to problems.
 */
public final class StyleGuide {

    public static final String BASE = "http://golang.org/s/comments";

    public static final String PACKAGE_COMMENTS = BASE + "#Package_Comments";
    public static final String IMPORT_DOT = BASE + "#Import_Dot";
    public static final String DOC_COMMENTS = BASE + "#Doc_Comments";
    public static final String MIXED_CAPS = BASE + "#Mixed_Caps";
    public static final String INITIALISMS = BASE + "#Initialisms";
    public static final String INDENT_ERROR_FLOW = BASE + "#Indent_Error_Flow";
    public static final String ERROR_STRINGS = BASE + "#Error_Strings";
    public static final String RECEIVER_NAMES = BASE + "#Receiver_Names";

    public static final String EFFECTIVE_GO_MIXED_CAPS = "http://golang.org/doc/effective_go.html#mixed-caps";
    public static final String EFFECTIVE_GO_PACKAGE_NAMES = "http://golang.org/doc/effective_go.html#package-names";

    private StyleGuide() {
    }
}
