package org.pragmatica.phpfmt.ast;

import java.util.List;

/**
 * Possibly namespaced name: {@code Foo\Bar}, {@code \Foo\Bar} or {@code namespace\Foo}.
 */
public record Name(List<String> parts, Qualification qualification, Attributes attributes) implements PhpNode {

    public enum Qualification {
        UNQUALIFIED,
        FULLY_QUALIFIED,
        RELATIVE
    }

    public Name {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Name must have at least one part");
        }
        parts = List.copyOf(parts);
    }

    public static Name name(String name) {
        var qualification = Qualification.UNQUALIFIED;
        var text = name;

        if (text.startsWith("\\")) {
            qualification = Qualification.FULLY_QUALIFIED;
            text = text.substring(1);
        } else if (text.startsWith("namespace\\")) {
            qualification = Qualification.RELATIVE;
            text = text.substring("namespace\\".length());
        }

        return new Name(List.of(text.split("\\\\")), qualification, Attributes.EMPTY);
    }

    public String last() {
        return parts.get(parts.size() - 1);
    }

    public String asString() {
        var joined = String.join("\\", parts);
        return switch (qualification) {
            case UNQUALIFIED -> joined;
            case FULLY_QUALIFIED -> "\\" + joined;
            case RELATIVE -> "namespace\\" + joined;
        };
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
