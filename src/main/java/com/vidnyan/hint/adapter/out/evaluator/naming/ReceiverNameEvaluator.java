package com.vidnyan.hint.adapter.out.evaluator.naming;

import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.lint.StyleGuide;
import com.vidnyan.hint.domain.resolve.ReceiverTypes;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checks method receiver names.
 * <p>
 * By default receivers must not be blank or generic ("me", "this", "self") and must be named
 * the same way for every method of a type. With a fixed receiver name configured, every named
 * receiver must use exactly that name instead.
 */
@Component
@Order(110)
public class ReceiverNameEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isReceiverNames();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        LintConfig config = file.getConfig();
        if (config.isUseFixedReceiverName()) {
            checkFixed(file, problems, config.getFixedReceiverName());
        } else {
            checkConsistent(file, problems, config);
        }
    }

    private void checkFixed(FileContext file, ProblemCollector problems, String fixed) {
        file.walk(node -> {
            if (!(node instanceof FuncDecl fn)) {
                return true;
            }
            ReceiverTypes.receiverName(fn)
                    .filter(name -> !name.name().equals(fixed))
                    .ifPresent(name -> problems.report(fn, 1, Category.NAMING, "receiver name should be '%s'", fixed));
            return true;
        });
    }

    private void checkConsistent(FileContext file, ProblemCollector problems, LintConfig config) {
        Map<String, String> typeReceiver = new HashMap<>();
        file.walk(node -> {
            if (!(node instanceof FuncDecl fn)) {
                return true;
            }
            Optional<Expr.Ident> id = ReceiverTypes.receiverName(fn);
            if (id.isEmpty()) {
                return true;
            }
            String name = id.get().name();
            if (id.get().isBlank()) {
                problems.report(fn, 1, StyleGuide.RECEIVER_NAMES, Category.NAMING,
                        "receiver name should not be an underscore");
                return true;
            }
            if (config.getDisallowedReceiverNames().contains(name)) {
                problems.report(fn, 1, StyleGuide.RECEIVER_NAMES, Category.NAMING,
                        "receiver name should be a reflection of its identity; "
                                + "don't use generic names such as \"me\", \"this\", or \"self\"");
                return true;
            }
            Optional<String> recv = ReceiverTypes.of(fn);
            if (recv.isEmpty()) {
                return true;
            }
            String prev = typeReceiver.get(recv.get());
            if (prev != null && !prev.equals(name)) {
                problems.report(fn, 1, StyleGuide.RECEIVER_NAMES, Category.NAMING,
                        "receiver name %s should be consistent with previous receiver name %s for %s",
                        name, prev, recv.get());
                return true;
            }
            typeReceiver.put(recv.get(), name);
            return true;
        });
    }
}
