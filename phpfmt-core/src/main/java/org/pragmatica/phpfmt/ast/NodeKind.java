package org.pragmatica.phpfmt.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of node kinds, one per node record.
 */
public enum NodeKind {
    STMT_ECHO(Stmt.Echo.class),
    STMT_RETURN(Stmt.Return.class),
    STMT_IF(Stmt.If.class),
    STMT_ELSE_IF(Stmt.ElseIf.class),
    STMT_ELSE(Stmt.Else.class),
    STMT_FOR(Stmt.For.class),
    STMT_FOREACH(Stmt.Foreach.class),
    STMT_WHILE(Stmt.While.class),
    STMT_DO(Stmt.Do.class),
    STMT_SWITCH(Stmt.Switch.class),
    STMT_CASE(Stmt.Case.class),
    STMT_TRY_CATCH(Stmt.TryCatch.class),
    STMT_CATCH(Stmt.Catch.class),
    STMT_FINALLY(Stmt.Finally.class),
    STMT_THROW(Stmt.Throw.class),
    STMT_BREAK(Stmt.Break.class),
    STMT_CONTINUE(Stmt.Continue.class),
    STMT_GOTO(Stmt.Goto.class),
    STMT_LABEL(Stmt.Label.class),
    STMT_STATIC(Stmt.Static.class),
    STMT_GLOBAL(Stmt.Global.class),
    STMT_UNSET(Stmt.Unset.class),
    STMT_EXPRESSION(Stmt.Expression.class),
    STMT_NOP(Stmt.Nop.class),
    STMT_INLINE_HTML(Stmt.InlineHtml.class),
    STMT_NAMESPACE(Stmt.Namespace.class),
    STMT_USE(Stmt.Use.class),
    STMT_GROUP_USE(Stmt.GroupUse.class),
    STMT_CONST(Stmt.Const.class),
    STMT_CLASS_CONST(Stmt.ClassConst.class),
    STMT_PROPERTY(Stmt.Property.class),
    STMT_FUNCTION_DECL(Stmt.FunctionDecl.class),
    STMT_CLASS_METHOD(Stmt.ClassMethod.class),
    STMT_CLASS_DECL(Stmt.ClassDecl.class),
    STMT_INTERFACE_DECL(Stmt.InterfaceDecl.class),
    STMT_TRAIT_DECL(Stmt.TraitDecl.class),
    STMT_TRAIT_USE(Stmt.TraitUse.class),
    STMT_TRAIT_ALIAS(Stmt.TraitAlias.class),
    STMT_TRAIT_PRECEDENCE(Stmt.TraitPrecedence.class),

    EXPR_VARIABLE(Expr.Variable.class),
    EXPR_ASSIGN(Expr.Assign.class),
    EXPR_ASSIGN_REF(Expr.AssignRef.class),
    EXPR_ASSIGN_OP(Expr.AssignOp.class),
    EXPR_BINARY_OP(Expr.BinaryOp.class),
    EXPR_UNARY_OP(Expr.UnaryOp.class),
    EXPR_TERNARY(Expr.Ternary.class),
    EXPR_INSTANCEOF(Expr.Instanceof.class),
    EXPR_FUNC_CALL(Expr.FuncCall.class),
    EXPR_METHOD_CALL(Expr.MethodCall.class),
    EXPR_STATIC_CALL(Expr.StaticCall.class),
    EXPR_PROPERTY_FETCH(Expr.PropertyFetch.class),
    EXPR_STATIC_PROPERTY_FETCH(Expr.StaticPropertyFetch.class),
    EXPR_CLASS_CONST_FETCH(Expr.ClassConstFetch.class),
    EXPR_CONST_FETCH(Expr.ConstFetch.class),
    EXPR_ARRAY_DIM_FETCH(Expr.ArrayDimFetch.class),
    EXPR_ARRAY_LITERAL(Expr.ArrayLiteral.class),
    EXPR_LIST_EXPR(Expr.ListExpr.class),
    EXPR_NEW(Expr.New.class),
    EXPR_CLONE(Expr.Clone.class),
    EXPR_ISSET(Expr.Isset.class),
    EXPR_EMPTY(Expr.Empty.class),
    EXPR_EVAL(Expr.Eval.class),
    EXPR_INCLUDE(Expr.Include.class),
    EXPR_EXIT(Expr.Exit.class),
    EXPR_PRINT(Expr.Print.class),
    EXPR_CLOSURE(Expr.Closure.class),
    EXPR_ARROW_FUNCTION(Expr.ArrowFunction.class),
    EXPR_CAST(Expr.Cast.class),
    EXPR_ERROR(Expr.Error.class),
    EXPR_STRING_LITERAL(Expr.StringLiteral.class),
    EXPR_INTERPOLATED_STRING(Expr.InterpolatedString.class),
    EXPR_INT_LITERAL(Expr.IntLiteral.class),
    EXPR_FLOAT_LITERAL(Expr.FloatLiteral.class),
    EXPR_MAGIC_CONST(Expr.MagicConst.class),

    NAME(Name.class),
    IDENTIFIER(Identifier.class),
    NULLABLE_TYPE(NullableType.class),
    PARAM(Param.class),
    ARG(Arg.class),
    ARRAY_ITEM(ArrayItem.class),
    INTERPOLATED_STRING_PART(InterpolatedStringPart.class),
    CLOSURE_USE(ClosureUse.class),
    CONST_DECL(ConstDecl.class),
    STATIC_VAR(StaticVar.class),
    USE_ITEM(UseItem.class),
    PROPERTY_ITEM(PropertyItem.class);

    private static final Map<Class<?>, NodeKind> BY_TYPE = new HashMap<>();

    static {
        for (var kind : values()) {
            BY_TYPE.put(kind.type, kind);
        }
    }

    private final Class<? extends PhpNode> type;

    NodeKind(Class<? extends PhpNode> type) {
        this.type = type;
    }

    public Class<? extends PhpNode> type() {
        return type;
    }

    public boolean isStatement() {
        return Stmt.class.isAssignableFrom(type);
    }

    public static NodeKind of(PhpNode node) {
        return BY_TYPE.get(node.getClass());
    }
}
