package org.pragmatica.phpfmt.ast;

import java.util.Optional;

/**
 * Imported name of a use or group use statement. {@code type} is {@link UseType#UNKNOWN}
 * unless a group use mixes kinds.
 */
public record UseItem(Name name, Optional<Identifier> alias, UseType type, Attributes attributes) implements PhpNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
