package org.pragmatica.phpfmt.ast;

/**
 * Compile-time "magic" constants.
 */
public enum MagicConstKind {
    LINE("__LINE__"),
    FILE("__FILE__"),
    DIR("__DIR__"),
    FUNCTION("__FUNCTION__"),
    CLASS("__CLASS__"),
    TRAIT("__TRAIT__"),
    METHOD("__METHOD__"),
    NAMESPACE("__NAMESPACE__");

    private final String token;

    MagicConstKind(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
