package org.pragmatica.phpfmt.ast;

import java.util.Set;

/**
 * Member and class modifiers, declared in the order they are printed.
 */
public enum Modifier {
    FINAL,
    ABSTRACT,
    PUBLIC,
    PROTECTED,
    PRIVATE,
    STATIC,
    READONLY;

    public String keyword() {
        return name().toLowerCase();
    }

    /**
     * Modifiers followed by a space each, in canonical order; empty for no modifiers.
     */
    public static String render(Set<Modifier> modifiers) {
        var sb = new StringBuilder();
        for (var modifier : values()) {
            if (modifiers.contains(modifier)) {
                sb.append(modifier.keyword()).append(' ');
            }
        }
        return sb.toString();
    }
}
