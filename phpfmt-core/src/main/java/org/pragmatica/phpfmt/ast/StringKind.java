package org.pragmatica.phpfmt.ast;

/**
 * Quoting style a string literal was written with.
 */
public enum StringKind {
    SINGLE_QUOTED,
    DOUBLE_QUOTED,
    HEREDOC,
    NOWDOC
}
