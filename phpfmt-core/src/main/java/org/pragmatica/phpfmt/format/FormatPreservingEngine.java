package org.pragmatica.phpfmt.format;

import org.pragmatica.phpfmt.ast.Stmt;
import org.pragmatica.phpfmt.ast.Token;
import org.pragmatica.phpfmt.format.printer.NodeRenderer;

import java.util.List;

/**
 * Reprints a modified tree, keeping the original source text of everything that did not change.
 */
public interface FormatPreservingEngine {

    /**
     * @param stmts          current statements
     * @param originalStmts  statements as parsed, carrying token spans
     * @param originalTokens tokens of the parsed source
     * @param renderer       renders the statements that changed
     */
    String reprint(List<? extends Stmt> stmts,
                   List<? extends Stmt> originalStmts,
                   List<Token> originalTokens,
                   NodeRenderer renderer);
}
