package com.vidnyan.hint.adapter.out.evaluator.comments;

import com.vidnyan.hint.domain.ast.CommentGroup;
import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.ast.Decl.GenDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Idents;
import com.vidnyan.hint.domain.ast.Spec.TypeSpec;
import com.vidnyan.hint.domain.ast.Spec.ValueSpec;
import com.vidnyan.hint.domain.ast.Token;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.lint.StyleGuide;
import com.vidnyan.hint.domain.resolve.ReceiverTypes;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks doc comments of exported functions, methods, types, vars and consts, and names that
 * stutter with the package name.
 * <p>
 * Declaration groups are tracked so that a comment on a {@code const ( ... )} block covers
 * its members, and a missing comment is reported once per group.
 */
@Component
@Order(30)
public class ExportedEvaluator implements RuleEvaluator {

    private static final List<String> ARTICLES = List.of("A", "An", "The");

    /** Methods whose meaning is fixed by well-known interfaces. */
    private static final Set<String> COMMON_METHODS = Set.of("Error", "Read", "ServeHTTP", "String", "Write");

    private static final Set<String> SORT_METHODS = Set.of("Len", "Less", "Swap");

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isExported();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        if (file.isTest()) {
            return;
        }
        boolean checkStutter = !file.getConfig().isAllowPackagePrefixInNames();
        Set<GenDecl> flaggedGroups = Collections.newSetFromMap(new IdentityHashMap<>());
        GenDecl[] lastGen = new GenDecl[1];

        file.walk(node -> {
            if (node instanceof GenDecl gen) {
                if (gen.tok() == Token.IMPORT) {
                    return false;
                }
                lastGen[0] = gen;
                return true;
            }
            if (node instanceof FuncDecl fn) {
                checkFuncDoc(file, problems, fn);
                if (checkStutter) {
                    checkStutter(file, problems, fn.name(), fn.isMethod() ? "method" : "func");
                }
                return false;
            }
            if (node instanceof TypeSpec ts) {
                CommentGroup doc = ts.doc() != null ? ts.doc() : lastGen[0].doc();
                checkTypeDoc(problems, ts, doc);
                if (checkStutter) {
                    checkStutter(file, problems, ts.name(), "type");
                }
                return false;
            }
            if (node instanceof ValueSpec vs) {
                checkValueSpecDoc(problems, vs, lastGen[0], flaggedGroups);
                return false;
            }
            return true;
        });
    }

    private void checkFuncDoc(FileContext file, ProblemCollector problems, FuncDecl fn) {
        if (!fn.name().isExported()) {
            return;
        }
        String kind = "function";
        String name = fn.name().name();
        if (fn.isMethod()) {
            kind = "method";
            Optional<String> recv = ReceiverTypes.of(fn);
            if (recv.isEmpty() || !Idents.isExported(recv.get())) {
                return;
            }
            if (COMMON_METHODS.contains(name)) {
                return;
            }
            if (SORT_METHODS.contains(name) && file.isSortable(recv.get())) {
                return;
            }
            name = recv.get() + "." + name;
        }
        if (fn.doc() == null) {
            problems.report(fn, 1, StyleGuide.DOC_COMMENTS, Category.COMMENTS,
                    "exported %s %s should have comment or be unexported", kind, name);
            return;
        }
        String prefix = fn.name().name() + " ";
        if (!fn.doc().text().startsWith(prefix)) {
            problems.report(fn.doc(), 1, StyleGuide.DOC_COMMENTS, Category.COMMENTS,
                    "comment on exported %s %s should be of the form \"%s...\"", kind, name, prefix);
        }
    }

    private void checkTypeDoc(ProblemCollector problems, TypeSpec ts, CommentGroup doc) {
        String name = ts.name().name();
        if (!ts.name().isExported()) {
            return;
        }
        if (doc == null) {
            problems.report(ts, 1, StyleGuide.DOC_COMMENTS, Category.COMMENTS,
                    "exported type %s should have comment or be unexported", name);
            return;
        }
        String text = doc.text();
        for (String article : ARTICLES) {
            if (text.startsWith(article + " ")) {
                text = text.substring(article.length() + 1);
                break;
            }
        }
        if (!text.startsWith(name + " ")) {
            problems.report(doc, 1, StyleGuide.DOC_COMMENTS, Category.COMMENTS,
                    "comment on exported type %s should be of the form \"%s ...\" (with optional leading article)",
                    name, name);
        }
    }

    private void checkValueSpecDoc(ProblemCollector problems, ValueSpec vs, GenDecl gen, Set<GenDecl> flaggedGroups) {
        String kind = gen.tok() == Token.CONST ? "const" : "var";

        if (vs.names().size() > 1) {
            // Only the first name may be exported.
            for (Expr.Ident n : vs.names().subList(1, vs.names().size())) {
                if (n.isExported()) {
                    problems.report(vs, 1, Category.COMMENTS,
                            "exported %s %s should have its own declaration", kind, n.name());
                    return;
                }
            }
        }

        String name = vs.names().get(0).name();
        if (!Idents.isExported(name)) {
            return;
        }
        if (vs.doc() == null) {
            if (gen.doc() == null && !flaggedGroups.contains(gen)) {
                String block = "";
                if (gen.tok() == Token.CONST && gen.isGrouped()) {
                    block = " (or a comment on this block)";
                }
                problems.report(vs, 1, StyleGuide.DOC_COMMENTS, Category.COMMENTS,
                        "exported %s %s should have comment%s or be unexported", kind, name, block);
                flaggedGroups.add(gen);
            }
            return;
        }
        String prefix = name + " ";
        if (!vs.doc().text().startsWith(prefix)) {
            problems.report(vs.doc(), 1, StyleGuide.DOC_COMMENTS, Category.COMMENTS,
                    "comment on exported %s %s should be of the form \"%s...\"", kind, name, prefix);
        }
    }

    /**
     * A name stutters if the package name is a strict prefix (ignoring case) and the rest of the
     * name starts a new word.
     */
    private void checkStutter(FileContext file, ProblemCollector problems, Expr.Ident id, String thing) {
        String pkg = file.packageName();
        String name = id.name();
        if (!id.isExported()) {
            return;
        }
        // A name no longer than the package name may repeat it, e.g. package url's type URL.
        if (name.length() <= pkg.length()) {
            return;
        }
        if (!pkg.equalsIgnoreCase(name.substring(0, pkg.length()))) {
            return;
        }
        String rem = name.substring(pkg.length());
        int next = rem.codePointAt(0);
        if (next == '_' || Character.isUpperCase(next)) {
            problems.report(id, 0.8, Category.NAMING,
                    "%s name will be used as %s.%s by other packages, and that stutters; consider calling this %s",
                    thing, pkg, name, rem);
        }
    }
}
