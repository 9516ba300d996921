package org.pragmatica.phpfmt.ast;

public record NullableType(PhpNode type, Attributes attributes) implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
