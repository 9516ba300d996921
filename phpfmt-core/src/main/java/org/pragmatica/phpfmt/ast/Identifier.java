package org.pragmatica.phpfmt.ast;

/**
 * Plain identifier: method, property, constant, label or declared name.
 */
public record Identifier(String name, Attributes attributes) implements PhpNode {

    public static Identifier identifier(String name) {
        return new Identifier(name, Attributes.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
