package org.pragmatica.phpfmt.format.printer;

import org.pragmatica.phpfmt.format.StateInvariantException;

/**
 * Current indentation depth and the newline-plus-indent string placed between statements.
 */
public final class IndentationTracker {
    public static final int DRUPAL_UNIT = 2;
    public static final int STANDARD_UNIT = 4;

    private final int unit;
    private int depth;
    private String newline = "\n";

    private IndentationTracker(int unit) {
        this.unit = unit;
    }

    public static IndentationTracker indentationTracker(int unit) {
        if (unit <= 0) {
            throw new IllegalArgumentException("Indentation unit must be positive: " + unit);
        }
        return new IndentationTracker(unit);
    }

    public void indent() {
        depth++;
        newline = newline + unitSpaces();
    }

    public void outdent() {
        if (depth == 0) {
            throw new StateInvariantException("Outdent below zero indentation");
        }
        depth--;
        newline = "\n" + " ".repeat(depth * unit);
    }

    /**
     * Indents now and outdents when the returned scope closes.
     */
    public Scope indented() {
        indent();
        return this::outdent;
    }

    /**
     * Line break followed by the current indentation.
     */
    public String newline() {
        return newline;
    }

    /**
     * One indentation unit worth of spaces.
     */
    public String unitSpaces() {
        return " ".repeat(unit);
    }

    public int depth() {
        return depth;
    }

    public int unit() {
        return unit;
    }

    void reset() {
        depth = 0;
        newline = "\n";
    }
}
