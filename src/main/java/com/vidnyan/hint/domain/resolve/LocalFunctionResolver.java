package com.vidnyan.hint.domain.resolve;

import com.vidnyan.hint.domain.ast.AstWalker;
import com.vidnyan.hint.domain.ast.Decl;
import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Field;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.ast.Node;
import com.vidnyan.hint.domain.ast.Spec;
import com.vidnyan.hint.domain.ast.Stmt;
import com.vidnyan.hint.domain.ast.Token;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves bare identifier call targets to function declarations of the same file.
 * <p>
 * Only receiver-less top-level functions are candidates. A name declared more than once at
 * file scope, or re-bound inside the calling declaration, resolves to nothing: the resolver
 * never guesses.
 */
public final class LocalFunctionResolver {

    private final Map<String, FuncDecl> functions = new HashMap<>();
    private final Set<String> ambiguous = new HashSet<>();

    private LocalFunctionResolver() {
    }

    public static LocalFunctionResolver build(GoFile file) {
        LocalFunctionResolver resolver = new LocalFunctionResolver();
        Map<String, Integer> declared = new HashMap<>();
        for (Decl decl : file.decls()) {
            if (decl instanceof FuncDecl fn) {
                if (fn.isMethod()) {
                    continue;
                }
                declared.merge(fn.name().name(), 1, Integer::sum);
                resolver.functions.put(fn.name().name(), fn);
            } else if (decl instanceof Decl.GenDecl gen && gen.tok() != Token.IMPORT) {
                for (Spec spec : gen.specs()) {
                    if (spec instanceof Spec.ValueSpec vs) {
                        vs.names().forEach(n -> declared.merge(n.name(), 1, Integer::sum));
                    } else if (spec instanceof Spec.TypeSpec ts) {
                        declared.merge(ts.name().name(), 1, Integer::sum);
                    }
                }
            }
        }
        declared.forEach((name, count) -> {
            if (count > 1) {
                resolver.ambiguous.add(name);
            }
        });
        return resolver;
    }

    /**
     * Resolves the function a call invokes.
     *
     * @param fun     the call's function expression; anything but a bare identifier is unresolved
     * @param shadows names bound locally around the call site
     */
    public Optional<FuncDecl> resolve(Expr fun, Set<String> shadows) {
        if (!(fun instanceof Expr.Ident id)) {
            return Optional.empty();
        }
        String name = id.name();
        if (ambiguous.contains(name) || shadows.contains(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Names bound anywhere inside a declaration: receiver, parameters, results, short variable
     * declarations, local var/const/type specs and range variables.
     */
    public static Set<String> boundNames(Node scope) {
        Set<String> names = new HashSet<>();
        AstWalker.walk(scope, node -> {
            if (node instanceof Expr.StructType || node instanceof Expr.InterfaceType) {
                return false;
            }
            if (node instanceof Field field) {
                field.names().forEach(n -> names.add(n.name()));
            } else if (node instanceof Stmt.AssignStmt as && as.tok() == Token.DEFINE) {
                as.lhs().forEach(e -> addIdent(names, e));
            } else if (node instanceof Stmt.RangeStmt rs && rs.tok() == Token.DEFINE) {
                addIdent(names, rs.key());
                addIdent(names, rs.value());
            } else if (node instanceof Spec.ValueSpec vs) {
                vs.names().forEach(n -> names.add(n.name()));
            } else if (node instanceof Spec.TypeSpec ts) {
                names.add(ts.name().name());
            }
            return true;
        });
        return names;
    }

    private static void addIdent(Set<String> names, Expr e) {
        if (e instanceof Expr.Ident id) {
            names.add(id.name());
        }
    }
}
