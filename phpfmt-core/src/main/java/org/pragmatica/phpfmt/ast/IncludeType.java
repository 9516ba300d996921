package org.pragmatica.phpfmt.ast;

public enum IncludeType {
    INCLUDE("include"),
    INCLUDE_ONCE("include_once"),
    REQUIRE("require"),
    REQUIRE_ONCE("require_once");

    private final String keyword;

    IncludeType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
