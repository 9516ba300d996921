package org.pragmatica.phpfmt.ast;

import java.util.Optional;

/**
 * Entry of an array or list literal.
 */
public record ArrayItem(Optional<Expr> key, Expr value, boolean byRef, boolean unpack, Attributes attributes)
        implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
