package org.pragmatica.phpfmt.ast;

/**
 * Kind of a {@code use} import.
 */
public enum UseType {
    UNKNOWN(""),
    NORMAL(""),
    FUNCTION("function"),
    CONSTANT("const");

    private final String keyword;

    UseType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
