package com.vidnyan.hint.adapter.out.evaluator.idiom;

import com.vidnyan.hint.domain.ast.Decl.GenDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Idents;
import com.vidnyan.hint.domain.ast.Spec.ValueSpec;
import com.vidnyan.hint.domain.ast.Token;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks var declarations whose explicit type is redundant: the initializer is the zero value,
 * or the type would be inferred from the right-hand side anyway.
 */
@Component
@Order(50)
public class VarDeclEvaluator implements RuleEvaluator {

    /** Literals that are zero values. Not exhaustive. */
    private static final Set<String> ZERO_LITERALS = Set.of(
            "false",
            "'\\x00'", "'\\000'",
            "\"\"", "``",
            "0", "0.", "0.0", "0i");

    private static final Map<Token, String> LITERAL_DEFAULT_TYPES = Map.of(
            Token.FLOAT, "float64",
            Token.IMAG, "complex128",
            Token.CHAR, "rune",
            Token.STRING, "string");

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isVarDecls();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        GenDecl[] lastGen = new GenDecl[1];
        file.walk(node -> {
            if (node instanceof GenDecl gen) {
                if (gen.tok() != Token.CONST && gen.tok() != Token.VAR) {
                    return false;
                }
                lastGen[0] = gen;
                return true;
            }
            if (!(node instanceof ValueSpec vs)) {
                return true;
            }
            if (lastGen[0].tok() == Token.CONST) {
                return false;
            }
            if (vs.names().size() > 1 || vs.type() == null || vs.values().isEmpty()) {
                return false;
            }
            // "var _ Interface = (*Concrete)(nil)" asserts interface satisfaction.
            if (vs.names().get(0).isBlank()) {
                return false;
            }
            Expr rhs = vs.values().get(0);
            String name = vs.names().get(0).name();
            if (isZeroValue(rhs)) {
                problems.report(rhs, 0.9, Category.ZERO_VALUE,
                        "should drop = %s from declaration of var %s; it is the zero value", file.render(rhs), name);
                return false;
            }
            // The right-hand side is probably a concrete type when the declared one is an interface.
            if (vs.type() instanceof Expr.InterfaceType) {
                return false;
            }
            // An untyped constant only has the declared type if that is its default type.
            Optional<String> defaultType = untypedConstType(rhs);
            if (defaultType.isPresent() && !Idents.isIdent(vs.type(), defaultType.get())) {
                return false;
            }
            problems.report(vs.type(), 0.8, Category.TYPE_INFERENCE,
                    "should omit type %s from declaration of var %s; it will be inferred from the right-hand side",
                    file.render(vs.type()), name);
            return false;
        });
    }

    private static boolean isZeroValue(Expr rhs) {
        if (rhs instanceof Expr.BasicLit lit) {
            return ZERO_LITERALS.contains(lit.value());
        }
        return Idents.isIdent(rhs, "nil");
    }

    /**
     * The default type of an untyped constant expression, if the expression is one.
     */
    static Optional<String> untypedConstType(Expr expr) {
        if (isIntLiteral(expr)) {
            return Optional.of("int");
        }
        if (expr instanceof Expr.BasicLit lit) {
            return Optional.ofNullable(LITERAL_DEFAULT_TYPES.get(lit.kind()));
        }
        return Optional.empty();
    }

    /**
     * An INT literal, possibly negated or parenthesized.
     */
    private static boolean isIntLiteral(Expr expr) {
        while (true) {
            if (expr instanceof Expr.UnaryExpr u && u.op() == Token.SUB) {
                expr = u.x();
            } else if (expr instanceof Expr.ParenExpr p) {
                expr = p.x();
            } else {
                return expr instanceof Expr.BasicLit lit && lit.kind() == Token.INT;
            }
        }
    }
}
