package org.pragmatica.phpfmt.ast;

import java.util.Optional;

/**
 * Function, method or closure parameter.
 */
public record Param(Optional<PhpNode> type,
                    boolean byRef,
                    boolean variadic,
                    Expr.Variable var,
                    Optional<Expr> defaultValue,
                    Attributes attributes) implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
