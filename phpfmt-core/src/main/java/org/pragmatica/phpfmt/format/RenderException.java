package org.pragmatica.phpfmt.format;

/**
 * Base of all failures raised while rendering a syntax tree. A render that throws produces no output.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }
}
