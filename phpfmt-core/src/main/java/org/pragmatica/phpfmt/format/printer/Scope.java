package org.pragmatica.phpfmt.format.printer;

/**
 * Restores a piece of traversal state when closed; used with try-with-resources so that
 * every push is paired with its pop on all exit paths.
 */
@FunctionalInterface
public interface Scope extends AutoCloseable {

    @Override
    void close();
}
