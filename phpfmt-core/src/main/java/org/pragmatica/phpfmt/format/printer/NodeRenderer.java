package org.pragmatica.phpfmt.format.printer;

import org.pragmatica.phpfmt.ast.PhpNode;
import org.pragmatica.phpfmt.ast.Stmt;

import java.util.List;

/**
 * Renders syntax tree nodes to source text.
 */
public interface NodeRenderer {

    /**
     * Renders a single node at the current indentation.
     */
    String render(PhpNode node);

    /**
     * Renders a single node as a complete top-level pass with fresh render state.
     */
    String renderNode(PhpNode node);

    /**
     * Renders {@code node} as an operand at {@code context}, parenthesized if its operator binds too loosely.
     */
    String render(PhpNode node, PrecedenceContext context);

    /**
     * Renders a statement list as a complete top-level pass: fresh render state, zero indentation,
     * leading whitespace removed.
     */
    String renderStatements(List<? extends Stmt> stmts);
}
