package org.pragmatica.phpfmt.format.printer;

/**
 * Operand position a child expression is rendered in: the parent operator's precedence and
 * associativity, and whether the child is the left ({@code -1}) or right ({@code 1}) operand.
 */
public record PrecedenceContext(int precedence, int associativity, int position) {
    public static final int LEFT = -1;
    public static final int NON_ASSOCIATIVE = 0;
    public static final int RIGHT = 1;

    /**
     * Position with no constraint: nothing is parenthesized.
     */
    public static final PrecedenceContext NONE = new PrecedenceContext(1000, NON_ASSOCIATIVE, 0);

    public static PrecedenceContext leftOf(Precedence.Level level) {
        return new PrecedenceContext(level.precedence(), level.associativity(), LEFT);
    }

    public static PrecedenceContext rightOf(Precedence.Level level) {
        return new PrecedenceContext(level.precedence(), level.associativity(), RIGHT);
    }
}
