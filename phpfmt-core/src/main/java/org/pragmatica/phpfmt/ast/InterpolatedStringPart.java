package org.pragmatica.phpfmt.ast;

/**
 * Literal text between the embedded expressions of an interpolated string.
 */
public record InterpolatedStringPart(String value, Attributes attributes) implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
