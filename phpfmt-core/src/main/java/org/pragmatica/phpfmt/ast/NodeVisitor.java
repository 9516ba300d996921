package org.pragmatica.phpfmt.ast;

/**
 * Visitor over the closed node set. Every node record dispatches to exactly one overload.
 */
public interface NodeVisitor<R> {

    R visit(Stmt.Echo node);

    R visit(Stmt.Return node);

    R visit(Stmt.If node);

    R visit(Stmt.ElseIf node);

    R visit(Stmt.Else node);

    R visit(Stmt.For node);

    R visit(Stmt.Foreach node);

    R visit(Stmt.While node);

    R visit(Stmt.Do node);

    R visit(Stmt.Switch node);

    R visit(Stmt.Case node);

    R visit(Stmt.TryCatch node);

    R visit(Stmt.Catch node);

    R visit(Stmt.Finally node);

    R visit(Stmt.Throw node);

    R visit(Stmt.Break node);

    R visit(Stmt.Continue node);

    R visit(Stmt.Goto node);

    R visit(Stmt.Label node);

    R visit(Stmt.Static node);

    R visit(Stmt.Global node);

    R visit(Stmt.Unset node);

    R visit(Stmt.Expression node);

    R visit(Stmt.Nop node);

    R visit(Stmt.InlineHtml node);

    R visit(Stmt.Namespace node);

    R visit(Stmt.Use node);

    R visit(Stmt.GroupUse node);

    R visit(Stmt.Const node);

    R visit(Stmt.ClassConst node);

    R visit(Stmt.Property node);

    R visit(Stmt.FunctionDecl node);

    R visit(Stmt.ClassMethod node);

    R visit(Stmt.ClassDecl node);

    R visit(Stmt.InterfaceDecl node);

    R visit(Stmt.TraitDecl node);

    R visit(Stmt.TraitUse node);

    R visit(Stmt.TraitAlias node);

    R visit(Stmt.TraitPrecedence node);

    R visit(Expr.Variable node);

    R visit(Expr.Assign node);

    R visit(Expr.AssignRef node);

    R visit(Expr.AssignOp node);

    R visit(Expr.BinaryOp node);

    R visit(Expr.UnaryOp node);

    R visit(Expr.Ternary node);

    R visit(Expr.Instanceof node);

    R visit(Expr.FuncCall node);

    R visit(Expr.MethodCall node);

    R visit(Expr.StaticCall node);

    R visit(Expr.PropertyFetch node);

    R visit(Expr.StaticPropertyFetch node);

    R visit(Expr.ClassConstFetch node);

    R visit(Expr.ConstFetch node);

    R visit(Expr.ArrayDimFetch node);

    R visit(Expr.ArrayLiteral node);

    R visit(Expr.ListExpr node);

    R visit(Expr.New node);

    R visit(Expr.Clone node);

    R visit(Expr.Isset node);

    R visit(Expr.Empty node);

    R visit(Expr.Eval node);

    R visit(Expr.Include node);

    R visit(Expr.Exit node);

    R visit(Expr.Print node);

    R visit(Expr.Closure node);

    R visit(Expr.ArrowFunction node);

    R visit(Expr.Cast node);

    R visit(Expr.Error node);

    R visit(Expr.StringLiteral node);

    R visit(Expr.InterpolatedString node);

    R visit(Expr.IntLiteral node);

    R visit(Expr.FloatLiteral node);

    R visit(Expr.MagicConst node);

    R visit(Name node);

    R visit(Identifier node);

    R visit(NullableType node);

    R visit(Param node);

    R visit(Arg node);

    R visit(ArrayItem node);

    R visit(InterpolatedStringPart node);

    R visit(ClosureUse node);

    R visit(ConstDecl node);

    R visit(StaticVar node);

    R visit(UseItem node);

    R visit(PropertyItem node);
}
