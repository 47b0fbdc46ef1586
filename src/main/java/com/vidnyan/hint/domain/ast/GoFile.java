package com.vidnyan.hint.domain.ast;

import java.util.List;

/**
 * Root of a parsed Go source file. The position is that of the {@code package} keyword.
 */
public record GoFile(
    CommentGroup doc,
    int pos,
    Expr.Ident name,
    List<Decl> decls,
    List<Spec.ImportSpec> imports,
    List<CommentGroup> comments,
    SourceSpans spans
) implements Node {

    public String packageName() {
        return name.name();
    }

    @Override
    public List<Node> children() {
        return Node.childrenOf(doc, name, decls);
    }
}
