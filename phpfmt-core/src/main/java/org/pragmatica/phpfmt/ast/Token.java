package org.pragmatica.phpfmt.ast;

/**
 * Lexer token. Whitespace and comments are tokens too, so concatenating all tokens
 * reproduces the original source.
 */
public record Token(String text) {}
