package org.pragmatica.phpfmt.format;

import org.pragmatica.phpfmt.ast.NodeKind;

/**
 * Node that has no printable form, such as the placeholder a parser leaves after a syntax error.
 */
public class UnsupportedNodeException extends RenderException {
    private final NodeKind kind;

    public UnsupportedNodeException(NodeKind kind) {
        super("Cannot render node of kind " + kind);
        this.kind = kind;
    }

    public NodeKind kind() {
        return kind;
    }
}
