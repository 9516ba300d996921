package org.pragmatica.phpfmt.ast;

import java.util.Optional;

public record PropertyItem(String name, Optional<Expr> defaultValue, Attributes attributes) implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
