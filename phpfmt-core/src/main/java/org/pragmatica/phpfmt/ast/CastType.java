package org.pragmatica.phpfmt.ast;

public enum CastType {
    INT,
    DOUBLE,
    STRING,
    BOOL,
    ARRAY,
    OBJECT,
    UNSET;

    public String keyword() {
        return name().toLowerCase();
    }
}
