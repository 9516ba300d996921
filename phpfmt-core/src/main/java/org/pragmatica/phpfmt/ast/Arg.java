package org.pragmatica.phpfmt.ast;

import java.util.Optional;

/**
 * Call argument. {@code name} is set for named arguments.
 */
public record Arg(Expr value, boolean byRef, boolean unpack, Optional<Identifier> name, Attributes attributes)
        implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
