package com.vidnyan.hint.adapter.out.parser;

import com.vidnyan.hint.domain.ast.CommentGroup;
import com.vidnyan.hint.domain.ast.Decl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Field;
import com.vidnyan.hint.domain.ast.FieldList;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.ast.Node;
import com.vidnyan.hint.domain.ast.SourceSpans;
import com.vidnyan.hint.domain.ast.Spec;
import com.vidnyan.hint.domain.ast.Stmt;
import com.vidnyan.hint.domain.ast.Token;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.child;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.end;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.field;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.fields;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.firstNamed;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.named;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.same;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.start;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.token;

/**
 * Maps a tree-sitter-go syntax tree onto the domain syntax tree.
 *
 * <p>Records the source range of every expression and statement so rules can quote them.
 * Rejects the constructs the grammar accepts but Go does not: a missing or blank package clause,
 * imports after other declarations, statements at file level, and {@code go} or {@code defer}
 * without a call.
 */
final class GoTreeMapper {

    private static final Set<String> NO_FIELDS = Set.of();

    private final byte[] source;
    private final CommentIndex comments;
    private final SourceSpans spans = new SourceSpans();
    private final List<Spec.ImportSpec> imports = new ArrayList<>();

    GoTreeMapper(byte[] source, CommentIndex comments) {
        this.source = source;
        this.comments = comments;
    }

    GoFile file(TSNode root) {
        List<TSNode> top = named(root);
        if (top.isEmpty() || !"package_clause".equals(top.get(0).getType())) {
            int at = top.isEmpty() ? source.length : start(top.get(0));
            String found = top.isEmpty() ? "EOF" : found(top.get(0));
            throw new ParseError(at, "expected 'package', found " + found);
        }
        TSNode clause = top.get(0);
        Expr.Ident name = ident(firstNamed(clause));
        if (name.isBlank()) {
            throw new ParseError(name.pos(), "invalid package name _");
        }

        List<Decl> decls = new ArrayList<>();
        boolean pastImports = false;
        for (TSNode node : top.subList(1, top.size())) {
            if ("import_declaration".equals(node.getType())) {
                if (pastImports) {
                    throw new ParseError(start(node), "imports must appear before other declarations");
                }
                decls.add(genDecl(node, Token.IMPORT));
            } else {
                pastImports = true;
                decls.add(decl(node));
            }
        }
        return new GoFile(comments.docAt(start(clause)), start(clause), name, decls, imports,
                comments.groups(), spans);
    }

    // ---------------------------------------------------------------------------------------
    // Declarations

    private Decl decl(TSNode node) {
        switch (node.getType()) {
            case "function_declaration":
            case "method_declaration":
                return funcDecl(node);
            case "const_declaration":
                return genDecl(node, Token.CONST);
            case "var_declaration":
                return genDecl(node, Token.VAR);
            case "type_declaration":
                return genDecl(node, Token.TYPE);
            default:
                throw new ParseError(start(node), "expected declaration, found " + found(node));
        }
    }

    private Decl.GenDecl genDecl(TSNode node, Token keyword) {
        List<TSNode> specNodes = new ArrayList<>();
        int lparen = collectSpecs(node, specNodes);
        List<Spec> specs = new ArrayList<>();
        for (TSNode s : specNodes) {
            // Go only documents specs individually inside parentheses.
            CommentGroup doc = lparen >= 0 ? comments.docAt(start(s)) : null;
            specs.add(spec(s, doc));
        }
        return track(new Decl.GenDecl(comments.docAt(start(node)), start(node), keyword, lparen, specs), node);
    }

    /**
     * Collects the specs of a declaration, looking into spec lists. Returns the offset of the
     * opening parenthesis, or -1.
     */
    private int collectSpecs(TSNode node, List<TSNode> out) {
        int lparen = -1;
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode c = node.getChild(i);
            String type = c.getType();
            if ("(".equals(type)) {
                lparen = lparen < 0 ? start(c) : lparen;
            } else if (type.endsWith("_spec_list")) {
                int inner = collectSpecs(c, out);
                lparen = lparen < 0 ? inner : lparen;
            } else if (type.endsWith("_spec") || "type_alias".equals(type)) {
                out.add(c);
            }
        }
        return lparen;
    }

    private Spec spec(TSNode s, CommentGroup doc) {
        CommentGroup line = comments.lineCommentAfter(end(s));
        switch (s.getType()) {
            case "import_spec": {
                TSNode name = field(s, "name");
                Spec.ImportSpec spec = new Spec.ImportSpec(doc, name == null ? null : ident(name),
                        basicLit(field(s, "path"), Token.STRING), line);
                imports.add(spec);
                return spec;
            }
            case "const_spec":
            case "var_spec":
                return new Spec.ValueSpec(doc, idents(fields(s, "name")), exprOrNull(field(s, "type")),
                        exprList(field(s, "value")), line);
            case "type_spec":
            case "type_alias": {
                TSNode params = field(s, "type_parameters");
                return new Spec.TypeSpec(doc, ident(field(s, "name")),
                        params == null ? null : params(params), "type_alias".equals(s.getType()),
                        expr(field(s, "type")), line);
            }
            default:
                throw new ParseError(start(s), "unexpected " + s.getType());
        }
    }

    private Decl.FuncDecl funcDecl(TSNode node) {
        TSNode receiver = field(node, "receiver");
        TSNode body = field(node, "body");
        return track(new Decl.FuncDecl(
                comments.docAt(start(node)),
                receiver == null ? null : params(receiver),
                ident(field(node, "name")),
                signature(node, start(node)),
                body == null ? null : block(body)), node);
    }

    private Expr.FuncType signature(TSNode node, int pos) {
        TSNode typeParams = field(node, "type_parameters");
        return new Expr.FuncType(pos,
                typeParams == null ? null : params(typeParams),
                params(field(node, "parameters")),
                results(field(node, "result")));
    }

    /**
     * Parameter, receiver and type parameter lists.
     */
    private FieldList params(TSNode list) {
        List<Field> out = new ArrayList<>();
        for (TSNode p : named(list)) {
            switch (p.getType()) {
                case "parameter_declaration":
                case "type_parameter_declaration":
                    out.add(new Field(null, idents(fields(p, "name")), expr(field(p, "type")), null, null));
                    break;
                case "variadic_parameter_declaration": {
                    TSNode dots = token(p, "...");
                    Expr.Ellipsis type = trackEnd(new Expr.Ellipsis(start(dots), expr(field(p, "type"))), end(p));
                    out.add(new Field(null, idents(fields(p, "name")), type, null, null));
                    break;
                }
                default:
                    throw new ParseError(start(p), "unexpected " + p.getType());
            }
        }
        return track(new FieldList(start(list), out), list);
    }

    private FieldList results(TSNode result) {
        if (result == null) {
            return null;
        }
        if ("parameter_list".equals(result.getType())) {
            return params(result);
        }
        return new FieldList(-1, List.of(new Field(null, List.of(), expr(result), null, null)));
    }

    private FieldList structFields(TSNode list) {
        List<Field> out = new ArrayList<>();
        for (TSNode f : named(list)) {
            List<Expr.Ident> names = idents(fields(f, "name"));
            TSNode typeNode = field(f, "type");
            Expr type = expr(typeNode);
            TSNode star = names.isEmpty() ? token(f, "*") : null;
            if (star != null) {
                type = trackEnd(new Expr.StarExpr(start(star), type), end(typeNode));
            }
            TSNode tag = field(f, "tag");
            out.add(new Field(comments.docAt(start(f)), names, type,
                    tag == null ? null : basicLit(tag, Token.STRING), comments.lineCommentAfter(end(f))));
        }
        return track(new FieldList(start(list), out), list);
    }

    private Expr interfaceType(TSNode node) {
        TSNode container = child(node, "method_spec_list");
        if (container == null) {
            container = node;
        }
        List<Field> out = new ArrayList<>();
        for (TSNode m : named(container)) {
            CommentGroup doc = comments.docAt(start(m));
            CommentGroup line = comments.lineCommentAfter(end(m));
            String type = m.getType();
            if ("method_spec".equals(type) || "method_elem".equals(type)) {
                TSNode params = field(m, "parameters");
                Expr.FuncType sig = new Expr.FuncType(start(params), null, params(params),
                        results(field(m, "result")));
                out.add(new Field(doc, List.of(ident(field(m, "name"))), sig, null, line));
            } else {
                out.add(new Field(doc, List.of(), expr(m), null, line));
            }
        }
        return track(new Expr.InterfaceType(start(node), new FieldList(start(token(container, "{")), out)), node);
    }

    // ---------------------------------------------------------------------------------------
    // Expressions and types

    private Expr expr(TSNode n) {
        switch (n.getType()) {
            case "identifier":
            case "field_identifier":
            case "type_identifier":
            case "package_identifier":
            case "label_name":
            case "blank_identifier":
            case "dot":
            case "nil":
            case "true":
            case "false":
            case "iota":
                return ident(n);
            case "int_literal":
                return basicLit(n, Token.INT);
            case "float_literal":
                return basicLit(n, Token.FLOAT);
            case "imaginary_literal":
                return basicLit(n, Token.IMAG);
            case "rune_literal":
                return basicLit(n, Token.CHAR);
            case "interpreted_string_literal":
            case "raw_string_literal":
                return basicLit(n, Token.STRING);
            case "parenthesized_expression":
            case "parenthesized_type":
                return track(new Expr.ParenExpr(start(n), expr(only(n))), n);
            case "selector_expression":
                return track(new Expr.SelectorExpr(expr(field(n, "operand")), ident(field(n, "field"))), n);
            case "qualified_type":
                return track(new Expr.SelectorExpr(ident(field(n, "package")), ident(field(n, "name"))), n);
            case "index_expression":
                return track(new Expr.IndexExpr(expr(field(n, "operand")), expr(field(n, "index"))), n);
            case "slice_expression": {
                TSNode capacity = field(n, "capacity");
                return track(new Expr.SliceExpr(expr(field(n, "operand")), exprOrNull(field(n, "start")),
                        exprOrNull(field(n, "end")), exprOrNull(capacity), capacity != null), n);
            }
            case "type_assertion_expression":
                return track(new Expr.TypeAssertExpr(expr(field(n, "operand")), expr(field(n, "type"))), n);
            case "call_expression":
                return call(n);
            case "type_conversion_expression":
                return track(new Expr.CallExpr(expr(field(n, "type")), List.of(expr(field(n, "operand"))), false), n);
            case "type_instantiation_expression": {
                TSNode base = field(n, "type");
                List<Expr> args = new ArrayList<>();
                for (TSNode c : named(n)) {
                    if (!same(c, base)) {
                        args.add(expr(c));
                    }
                }
                return track(instantiate(expr(base), args), n);
            }
            case "generic_type":
                return track(instantiate(expr(field(n, "type")), exprs(named(field(n, "type_arguments")))), n);
            case "unary_expression": {
                String op = text(field(n, "operator"));
                Expr x = expr(field(n, "operand"));
                if ("*".equals(op)) {
                    return track(new Expr.StarExpr(start(n), x), n);
                }
                return track(new Expr.UnaryExpr(start(n), Token.fromText(op), x), n);
            }
            case "binary_expression":
                return track(new Expr.BinaryExpr(expr(field(n, "left")), Token.fromText(text(field(n, "operator"))),
                        expr(field(n, "right"))), n);
            case "composite_literal": {
                TSNode body = field(n, "body");
                return track(new Expr.CompositeLit(expr(field(n, "type")), start(body), exprs(named(body))), n);
            }
            case "literal_value":
                return track(new Expr.CompositeLit(null, start(n), exprs(named(n))), n);
            case "literal_element":
            case "element":
                return expr(only(n));
            case "keyed_element": {
                List<TSNode> kv = named(n);
                return track(new Expr.KeyValueExpr(expr(kv.get(0)), expr(kv.get(kv.size() - 1))), n);
            }
            case "func_literal": {
                TSNode params = field(n, "parameters");
                TSNode result = field(n, "result");
                Expr.FuncType sig = trackEnd(new Expr.FuncType(start(n), null, params(params), results(result)),
                        end(result != null ? result : params));
                return track(new Expr.FuncLit(sig, block(field(n, "body"))), n);
            }
            case "pointer_type":
                return track(new Expr.StarExpr(start(n), expr(only(n))), n);
            case "array_type":
                return track(new Expr.ArrayType(start(n), expr(field(n, "length")), expr(field(n, "element"))), n);
            case "implicit_length_array_type": {
                TSNode dots = token(n, "...");
                Expr.Ellipsis len = trackEnd(new Expr.Ellipsis(start(dots), null), end(dots));
                return track(new Expr.ArrayType(start(n), len, expr(field(n, "element"))), n);
            }
            case "slice_type":
                return track(new Expr.ArrayType(start(n), null, expr(field(n, "element"))), n);
            case "map_type":
                return track(new Expr.MapType(start(n), expr(field(n, "key")), expr(field(n, "value"))), n);
            case "channel_type":
                return track(new Expr.ChanType(start(n), chanDir(n), expr(field(n, "value"))), n);
            case "function_type":
                return track(signature(n, start(n)), n);
            case "struct_type":
                return track(new Expr.StructType(start(n), structFields(child(n, "field_declaration_list"))), n);
            case "interface_type":
                return interfaceType(n);
            case "negated_type":
                return track(new Expr.UnaryExpr(start(n), Token.TILDE, expr(only(n))), n);
            case "constraint_term":
                if (token(n, "~") != null) {
                    return track(new Expr.UnaryExpr(start(n), Token.TILDE, expr(only(n))), n);
                }
                return expr(only(n));
            case "type_elem":
            case "type_constraint":
            case "constraint_elem":
            case "interface_type_name":
            case "struct_elem":
                return union(n);
            default:
                throw new ParseError(start(n), "unexpected " + found(n));
        }
    }

    /**
     * {@code A | B | C} as a left-leaning chain of {@code |} expressions.
     */
    private Expr union(TSNode n) {
        Expr x = null;
        for (TSNode term : named(n)) {
            Expr y = expr(term);
            x = x == null ? y : trackEnd(new Expr.BinaryExpr(x, Token.OR, y), end(term));
        }
        if (x == null) {
            throw new ParseError(start(n), "expected type, found " + found(n));
        }
        return x;
    }

    private Expr call(TSNode n) {
        Expr fun = expr(field(n, "function"));
        TSNode typeArgs = field(n, "type_arguments");
        if (typeArgs != null) {
            fun = trackEnd(instantiate(fun, exprs(named(typeArgs))), end(typeArgs));
        }
        TSNode argList = field(n, "arguments");
        boolean ellipsis = token(argList, "...") != null;
        List<Expr> args = new ArrayList<>();
        for (TSNode a : named(argList)) {
            if ("variadic_argument".equals(a.getType())) {
                ellipsis = true;
                args.add(expr(only(a)));
            } else {
                args.add(expr(a));
            }
        }
        return track(new Expr.CallExpr(fun, args, ellipsis), n);
    }

    private static Expr instantiate(Expr x, List<Expr> args) {
        return args.size() == 1 ? new Expr.IndexExpr(x, args.get(0)) : new Expr.IndexListExpr(x, args);
    }

    private static Expr.ChanDir chanDir(TSNode n) {
        int count = n.getChildCount();
        for (int i = 0; i < count; i++) {
            if ("<-".equals(n.getChild(i).getType())) {
                return i == 0 ? Expr.ChanDir.RECV : Expr.ChanDir.SEND;
            }
        }
        return Expr.ChanDir.BOTH;
    }

    private Expr.Ident ident(TSNode n) {
        return track(new Expr.Ident(start(n), text(n)), n);
    }

    private Expr.BasicLit basicLit(TSNode n, Token kind) {
        return track(new Expr.BasicLit(start(n), kind, text(n)), n);
    }

    private List<Expr.Ident> idents(List<TSNode> nodes) {
        List<Expr.Ident> out = new ArrayList<>(nodes.size());
        for (TSNode n : nodes) {
            out.add(ident(n));
        }
        return out;
    }

    private List<Expr> exprs(List<TSNode> nodes) {
        List<Expr> out = new ArrayList<>(nodes.size());
        for (TSNode n : nodes) {
            out.add(expr(n));
        }
        return out;
    }

    private List<Expr> exprList(TSNode n) {
        if (n == null) {
            return List.of();
        }
        return "expression_list".equals(n.getType()) ? exprs(named(n)) : List.of(expr(n));
    }

    private Expr exprOrNull(TSNode n) {
        return n == null ? null : expr(n);
    }

    // ---------------------------------------------------------------------------------------
    // Statements

    private Stmt stmt(TSNode n) {
        switch (n.getType()) {
            case "expression_statement":
                return track(new Stmt.ExprStmt(expr(only(n))), n);
            case "send_statement":
                return track(new Stmt.SendStmt(expr(field(n, "channel")), expr(field(n, "value"))), n);
            case "inc_statement":
                return track(new Stmt.IncDecStmt(expr(only(n)), Token.INC), n);
            case "dec_statement":
                return track(new Stmt.IncDecStmt(expr(only(n)), Token.DEC), n);
            case "assignment_statement":
                return track(new Stmt.AssignStmt(exprList(field(n, "left")),
                        Token.fromText(text(field(n, "operator"))), exprList(field(n, "right"))), n);
            case "short_var_declaration":
                return track(new Stmt.AssignStmt(exprList(field(n, "left")), Token.DEFINE,
                        exprList(field(n, "right"))), n);
            case "receive_statement": {
                TSNode left = field(n, "left");
                Expr right = expr(field(n, "right"));
                if (left == null) {
                    return track(new Stmt.ExprStmt(right), n);
                }
                Token tok = token(n, ":=") != null ? Token.DEFINE : Token.ASSIGN;
                return track(new Stmt.AssignStmt(exprList(left), tok, List.of(right)), n);
            }
            case "const_declaration":
            case "var_declaration":
            case "type_declaration":
                return track(new Stmt.DeclStmt((Decl.GenDecl) decl(n)), n);
            case "return_statement":
                return track(new Stmt.ReturnStmt(start(n), exprList(firstNamed(n))), n);
            case "go_statement":
                return track(new Stmt.GoStmt(start(n), invoked(n, "go")), n);
            case "defer_statement":
                return track(new Stmt.DeferStmt(start(n), invoked(n, "defer")), n);
            case "if_statement":
                return ifStmt(n);
            case "for_statement":
                return forStmt(n);
            case "expression_switch_statement":
                return switchStmt(n);
            case "type_switch_statement":
                return typeSwitchStmt(n);
            case "select_statement":
                return selectStmt(n);
            case "labeled_statement":
            case "empty_labeled_statement": {
                List<TSNode> rest = statements(n, Set.of("label"));
                Stmt inner = rest.isEmpty() ? new Stmt.EmptyStmt(end(n), true) : stmt(rest.get(0));
                return track(new Stmt.LabeledStmt(ident(field(n, "label")), inner), n);
            }
            case "break_statement":
                return branch(n, Token.BREAK);
            case "continue_statement":
                return branch(n, Token.CONTINUE);
            case "goto_statement":
                return branch(n, Token.GOTO);
            case "fallthrough_statement":
                return branch(n, Token.FALLTHROUGH);
            case "block":
                return block(n);
            case "empty_statement":
                return track(new Stmt.EmptyStmt(start(n), false), n);
            default:
                throw new ParseError(start(n), "expected statement, found " + found(n));
        }
    }

    private Stmt stmtOrNull(TSNode n) {
        return n == null ? null : stmt(n);
    }

    private List<Stmt> stmts(List<TSNode> nodes) {
        List<Stmt> out = new ArrayList<>(nodes.size());
        for (TSNode n : nodes) {
            out.add(stmt(n));
        }
        return out;
    }

    /**
     * Statement children of a block or clause, looking through statement lists and skipping the
     * children stored under the given fields.
     */
    private static List<TSNode> statements(TSNode n, Set<String> skipFields) {
        List<TSNode> out = new ArrayList<>();
        int count = n.getChildCount();
        for (int i = 0; i < count; i++) {
            String fieldName = n.getFieldNameForChild(i);
            if (fieldName != null && skipFields.contains(fieldName)) {
                continue;
            }
            TSNode c = n.getChild(i);
            if (!c.isNamed() || TreeSitterNodes.COMMENT.equals(c.getType())) {
                continue;
            }
            if ("statement_list".equals(c.getType())) {
                out.addAll(statements(c, NO_FIELDS));
            } else {
                out.add(c);
            }
        }
        return out;
    }

    private Stmt.BlockStmt block(TSNode n) {
        return track(new Stmt.BlockStmt(start(n), stmts(statements(n, NO_FIELDS))), n);
    }

    private Expr invoked(TSNode n, String keyword) {
        Expr x = expr(only(n));
        Expr call = x;
        while (call instanceof Expr.ParenExpr) {
            call = ((Expr.ParenExpr) call).x();
        }
        if (!(call instanceof Expr.CallExpr)) {
            throw new ParseError(x.pos(), "function must be invoked in " + keyword + " statement");
        }
        return call;
    }

    private Stmt branch(TSNode n, Token tok) {
        TSNode label = firstNamed(n);
        return track(new Stmt.BranchStmt(start(n), tok, label == null ? null : ident(label)), n);
    }

    private Stmt ifStmt(TSNode n) {
        TSNode alternative = field(n, "alternative");
        return track(new Stmt.IfStmt(start(n),
                stmtOrNull(field(n, "initializer")),
                expr(field(n, "condition")),
                block(field(n, "consequence")),
                alternative == null ? null : stmt(alternative)), n);
    }

    private Stmt forStmt(TSNode n) {
        TSNode bodyNode = field(n, "body");
        TSNode clause = null;
        for (TSNode c : named(n)) {
            if (!same(c, bodyNode)) {
                clause = c;
                break;
            }
        }
        Stmt.BlockStmt body = block(bodyNode);
        if (clause == null) {
            return track(new Stmt.ForStmt(start(n), null, null, null, body), n);
        }
        switch (clause.getType()) {
            case "for_clause":
                return track(new Stmt.ForStmt(start(n),
                        stmtOrNull(field(clause, "initializer")),
                        exprOrNull(field(clause, "condition")),
                        stmtOrNull(field(clause, "update")), body), n);
            case "range_clause": {
                List<Expr> lhs = exprList(field(clause, "left"));
                if (lhs.size() > 2) {
                    throw new ParseError(lhs.get(2).pos(), "range clause permits at most two iteration variables");
                }
                Token tok = lhs.isEmpty() ? null : token(clause, ":=") != null ? Token.DEFINE : Token.ASSIGN;
                return track(new Stmt.RangeStmt(start(n),
                        lhs.isEmpty() ? null : lhs.get(0),
                        lhs.size() < 2 ? null : lhs.get(1),
                        tok, expr(field(clause, "right")), body), n);
            }
            default:
                return track(new Stmt.ForStmt(start(n), null, expr(clause), null, body), n);
        }
    }

    private Stmt switchStmt(TSNode n) {
        List<Stmt> clauses = new ArrayList<>();
        for (TSNode c : named(n)) {
            if ("expression_case".equals(c.getType())) {
                clauses.add(caseClause(c, exprList(field(c, "value")), "value"));
            } else if ("default_case".equals(c.getType())) {
                clauses.add(caseClause(c, List.of(), null));
            }
        }
        return track(new Stmt.SwitchStmt(start(n),
                stmtOrNull(field(n, "initializer")),
                exprOrNull(field(n, "value")),
                body(n, clauses)), n);
    }

    private Stmt typeSwitchStmt(TSNode n) {
        TSNode alias = field(n, "alias");
        Expr guard = new Expr.TypeAssertExpr(expr(field(n, "value")), null);
        Stmt assign = alias == null
                ? new Stmt.ExprStmt(guard)
                : new Stmt.AssignStmt(exprList(alias), Token.DEFINE, List.of(guard));
        List<Stmt> clauses = new ArrayList<>();
        for (TSNode c : named(n)) {
            if ("type_case".equals(c.getType())) {
                clauses.add(caseClause(c, exprs(fields(c, "type")), "type"));
            } else if ("default_case".equals(c.getType())) {
                clauses.add(caseClause(c, List.of(), null));
            }
        }
        return track(new Stmt.TypeSwitchStmt(start(n), stmtOrNull(field(n, "initializer")), assign,
                body(n, clauses)), n);
    }

    private Stmt selectStmt(TSNode n) {
        List<Stmt> clauses = new ArrayList<>();
        for (TSNode c : named(n)) {
            if ("communication_case".equals(c.getType())) {
                clauses.add(track(new Stmt.CommClause(start(c), stmt(field(c, "communication")),
                        stmts(statements(c, Set.of("communication")))), c));
            } else if ("default_case".equals(c.getType())) {
                clauses.add(track(new Stmt.CommClause(start(c), null, stmts(statements(c, NO_FIELDS))), c));
            }
        }
        return track(new Stmt.SelectStmt(start(n), body(n, clauses)), n);
    }

    private Stmt caseClause(TSNode c, List<Expr> list, String listField) {
        Set<String> skip = listField == null ? NO_FIELDS : Set.of(listField);
        return track(new Stmt.CaseClause(start(c), list, stmts(statements(c, skip))), c);
    }

    /**
     * The braced clause list of a switch or select statement.
     */
    private Stmt.BlockStmt body(TSNode n, List<Stmt> clauses) {
        return trackEnd(new Stmt.BlockStmt(start(token(n, "{")), clauses), end(n));
    }

    // ---------------------------------------------------------------------------------------
    // Helpers

    private TSNode only(TSNode n) {
        TSNode c = firstNamed(n);
        if (c == null) {
            throw new ParseError(start(n), "expected operand, found " + found(n));
        }
        return c;
    }

    private String text(TSNode n) {
        return TreeSitterNodes.text(source, n);
    }

    private String found(TSNode n) {
        return TreeSitterNodes.found(source, n);
    }

    private <T extends Node> T track(T node, TSNode n) {
        return trackEnd(node, end(n));
    }

    private <T extends Node> T trackEnd(T node, int end) {
        spans.record(node, end);
        return node;
    }
}
