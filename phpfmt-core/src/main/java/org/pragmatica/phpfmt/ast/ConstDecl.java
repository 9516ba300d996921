package org.pragmatica.phpfmt.ast;

/**
 * Single {@code NAME = value} declaration of a const statement.
 */
public record ConstDecl(Identifier name, Expr value, Attributes attributes) implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
