package com.vidnyan.hint.domain.lint;

import com.vidnyan.hint.domain.ast.AstWalker;
import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.ast.Node;
import com.vidnyan.hint.domain.ast.NodeVisitor;
import com.vidnyan.hint.domain.resolve.LocalFunctionResolver;
import com.vidnyan.hint.domain.resolve.ReceiverTypes;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Everything the rules know about the file being linted.
 * Built once per lint call and discarded afterwards.
 */
@Value
@Builder
public class FileContext {

    private static final String TEST_SUFFIX = "_test.go";
    private static final String MAIN_PACKAGE = "main";

    String fileName;
    @Getter(AccessLevel.NONE)
    byte[] source;
    GoFile tree;
    LintConfig config;
    LineIndex lines;

    // Derived once per file, before any rule runs.
    boolean mainPackage;
    Set<String> sortableTypes;
    LocalFunctionResolver functions;

    /**
     * Create the context, computing the per-file derived state.
     */
    public static FileContext of(String fileName, byte[] source, GoFile tree, LintConfig config) {
        return FileContext.builder()
                .fileName(fileName)
                .source(source)
                .tree(tree)
                .config(config)
                .lines(new LineIndex(fileName, source))
                .mainPackage(MAIN_PACKAGE.equals(tree.packageName()))
                .sortableTypes(scanSortable(tree))
                .functions(LocalFunctionResolver.build(tree))
                .build();
    }

    public boolean isTest() {
        return fileName != null && fileName.endsWith(TEST_SUFFIX);
    }

    public String packageName() {
        return tree.packageName();
    }

    public boolean isSortable(String typeName) {
        return sortableTypes.contains(typeName);
    }

    public void walk(NodeVisitor visitor) {
        AstWalker.walk(tree, visitor);
    }

    /**
     * The node's source text, exactly as written.
     */
    public String render(Node node) {
        return tree.spans().text(source, node);
    }

    /**
     * Types with Len, Less and Swap methods declared in this file.
     */
    private static Set<String> scanSortable(GoFile tree) {
        final int len = 1;
        final int less = 1 << 1;
        final int swap = 1 << 2;
        Map<String, Integer> bits = Map.of("Len", len, "Less", less, "Swap", swap);
        Map<String, Integer> has = new HashMap<>();
        AstWalker.walk(tree, node -> {
            if (!(node instanceof FuncDecl fn) || !fn.isMethod()) {
                return true;
            }
            Integer bit = bits.get(fn.name().name());
            if (bit != null) {
                ReceiverTypes.of(fn).ifPresent(recv -> has.merge(recv, bit, (a, b) -> a | b));
            }
            return false;
        });
        Set<String> sortable = new HashSet<>();
        has.forEach((type, methods) -> {
            if (methods == (len | less | swap)) {
                sortable.add(type);
            }
        });
        return Set.copyOf(sortable);
    }
}
