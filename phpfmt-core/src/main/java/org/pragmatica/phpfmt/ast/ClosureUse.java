package org.pragmatica.phpfmt.ast;

public record ClosureUse(Expr.Variable var, boolean byRef, Attributes attributes) implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
