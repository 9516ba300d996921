package org.pragmatica.phpfmt.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shorthand constructors for building trees in code. Nodes get {@link Attributes#EMPTY}
 * unless a variant taking comments is used.
 */
public final class Nodes {
    private Nodes() {}

    // ===== Scalars and names =====

    public static Expr.Variable variable(String name) {
        return new Expr.Variable(name, Attributes.EMPTY);
    }

    public static Expr.StringLiteral string(String value) {
        return new Expr.StringLiteral(value, StringKind.SINGLE_QUOTED, "", Attributes.EMPTY);
    }

    public static Expr.StringLiteral doubleQuoted(String value) {
        return new Expr.StringLiteral(value, StringKind.DOUBLE_QUOTED, "", Attributes.EMPTY);
    }

    public static Expr.InterpolatedString interpolated(PhpNode... parts) {
        return new Expr.InterpolatedString(List.of(parts), StringKind.DOUBLE_QUOTED, "", Attributes.EMPTY);
    }

    public static InterpolatedStringPart text(String value) {
        return new InterpolatedStringPart(value, Attributes.EMPTY);
    }

    public static Expr.IntLiteral integer(long value) {
        return new Expr.IntLiteral(value, Attributes.EMPTY);
    }

    public static Expr.ConstFetch constant(String name) {
        return new Expr.ConstFetch(Name.name(name), Attributes.EMPTY);
    }

    public static Name name(String name) {
        return Name.name(name);
    }

    public static Identifier identifier(String name) {
        return new Identifier(name, Attributes.EMPTY);
    }

    // ===== Calls =====

    public static Arg arg(Expr value) {
        return new Arg(value, false, false, Optional.empty(), Attributes.EMPTY);
    }

    public static Expr.FuncCall call(String function, Expr... args) {
        return new Expr.FuncCall(Name.name(function), args(args), Attributes.EMPTY);
    }

    public static Expr.MethodCall methodCall(Expr receiver, String method, Expr... args) {
        return new Expr.MethodCall(receiver, identifier(method), args(args), false, Attributes.EMPTY);
    }

    public static Expr.StaticCall staticCall(String className, String method, Expr... args) {
        return new Expr.StaticCall(Name.name(className), identifier(method), args(args), Attributes.EMPTY);
    }

    public static Expr.PropertyFetch property(Expr receiver, String property) {
        return new Expr.PropertyFetch(receiver, identifier(property), false, Attributes.EMPTY);
    }

    private static List<Arg> args(Expr... values) {
        return Arrays.stream(values)
                     .map(Nodes::arg)
                     .toList();
    }

    // ===== Arrays =====

    public static Expr.ArrayLiteral array(ArrayItem... items) {
        return new Expr.ArrayLiteral(List.of(items), ArrayKind.UNSPECIFIED, Attributes.EMPTY);
    }

    public static Expr.ArrayLiteral array(ArrayKind syntax, ArrayItem... items) {
        return new Expr.ArrayLiteral(List.of(items), syntax, Attributes.EMPTY);
    }

    public static Expr.ArrayDimFetch dim(Expr var, Expr dim) {
        return new Expr.ArrayDimFetch(var, Optional.of(dim), Attributes.EMPTY);
    }

    public static ArrayItem item(Expr value) {
        return new ArrayItem(Optional.empty(), value, false, false, Attributes.EMPTY);
    }

    public static ArrayItem item(Expr key, Expr value) {
        return new ArrayItem(Optional.of(key), value, false, false, Attributes.EMPTY);
    }

    // ===== Expressions =====

    public static Expr.Assign assign(Expr target, Expr value) {
        return new Expr.Assign(target, value, Attributes.EMPTY);
    }

    public static Expr.BinaryOp binary(String operator, Expr left, Expr right) {
        return new Expr.BinaryOp(operator, left, right, Attributes.EMPTY);
    }

    public static Expr.Cast cast(CastType type, Expr expr) {
        return new Expr.Cast(type, expr, Attributes.EMPTY);
    }

    // ===== Statements =====

    public static Stmt.Expression statement(Expr expr) {
        return new Stmt.Expression(expr, Attributes.EMPTY);
    }

    public static Stmt.Return returns(Expr expr) {
        return new Stmt.Return(Optional.of(expr), Attributes.EMPTY);
    }

    public static Stmt.Echo echo(Expr... exprs) {
        return new Stmt.Echo(List.of(exprs), Attributes.EMPTY);
    }

    public static Stmt.If ifThen(Expr cond, Stmt... stmts) {
        return new Stmt.If(cond, List.of(stmts), List.of(), Optional.empty(), Attributes.EMPTY);
    }

    public static Param param(String name) {
        return new Param(Optional.empty(), false, false, variable(name), Optional.empty(), Attributes.EMPTY);
    }

    public static Stmt.FunctionDecl function(String name, List<Param> params, Stmt... stmts) {
        return new Stmt.FunctionDecl(false, identifier(name), params, Optional.empty(), List.of(stmts), Attributes.EMPTY);
    }

    public static Stmt.ClassMethod method(Set<Modifier> modifiers, String name, List<Param> params, Stmt... stmts) {
        return new Stmt.ClassMethod(modifiers,
                                    false,
                                    identifier(name),
                                    params,
                                    Optional.empty(),
                                    Optional.of(List.of(stmts)),
                                    Attributes.EMPTY);
    }

    public static Stmt.ClassDecl classDecl(String name, Stmt... stmts) {
        return new Stmt.ClassDecl(Set.of(),
                                  Optional.of(identifier(name)),
                                  Optional.empty(),
                                  List.of(),
                                  List.of(stmts),
                                  Attributes.EMPTY);
    }

    public static Stmt.Expression statement(Expr expr, String... comments) {
        return new Stmt.Expression(expr, commentsOf(comments));
    }

    /**
     * Placeholder statement carrying only comments, as parsers emit for trailing comments in a block.
     */
    public static Stmt.Nop nop(String... comments) {
        return new Stmt.Nop(commentsOf(comments));
    }

    private static Attributes commentsOf(String... comments) {
        return Attributes.commented(Arrays.stream(comments)
                                          .map(Comment::new)
                                          .toArray(Comment[]::new));
    }
}
