package org.pragmatica.phpfmt.format;

/**
 * Unbalanced traversal state: popping an empty call stack, outdenting below zero,
 * or re-entering a renderer that is already rendering.
 */
public class StateInvariantException extends RenderException {

    public StateInvariantException(String message) {
        super(message);
    }
}
