package org.pragmatica.phpfmt.ast;

/**
 * Inclusive range of token positions in the original token stream.
 */
public record SourceSpan(int startToken, int endToken) {

    public SourceSpan {
        if (startToken < 0 || endToken < startToken) {
            throw new IllegalArgumentException("Invalid token span [" + startToken + ", " + endToken + "]");
        }
    }
}
