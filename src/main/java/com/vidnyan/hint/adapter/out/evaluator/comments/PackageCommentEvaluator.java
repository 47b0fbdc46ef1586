package com.vidnyan.hint.adapter.out.evaluator.comments;

import com.vidnyan.hint.domain.ast.CommentGroup;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.lint.StyleGuide;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Checks the package comment: present, no leading space, and of the form "Package name ...".
 * A package comment may legitimately live in another file of the package, hence the low
 * confidence of the missing-comment problem.
 */
@Component
@Order(10)
public class PackageCommentEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isPackageComments();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        if (file.isTest()) {
            return;
        }
        GoFile tree = file.getTree();
        CommentGroup doc = tree.doc();
        if (doc == null) {
            problems.report(tree, 0.2, StyleGuide.PACKAGE_COMMENTS, Category.COMMENTS,
                    "should have a package comment, unless it's in another file for this package");
            return;
        }

        String text = doc.text();
        String prefix = "Package " + tree.packageName() + " ";
        String trimmed = stripLeadingBlanks(text);
        if (!trimmed.equals(text)) {
            problems.report(doc, 1, StyleGuide.PACKAGE_COMMENTS, Category.COMMENTS,
                    "package comment should not have leading space");
            text = trimmed;
        }
        // Only non-main packages need to keep to this form.
        if (!file.isMainPackage() && !text.startsWith(prefix)) {
            problems.report(doc, 1, StyleGuide.PACKAGE_COMMENTS, Category.COMMENTS,
                    "package comment should be of the form \"%s...\"", prefix);
        }
    }

    private static String stripLeadingBlanks(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
            i++;
        }
        return s.substring(i);
    }
}
