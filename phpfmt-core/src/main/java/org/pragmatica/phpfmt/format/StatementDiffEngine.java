package org.pragmatica.phpfmt.format;

import org.pragmatica.phpfmt.ast.SourceSpan;
import org.pragmatica.phpfmt.ast.Stmt;
import org.pragmatica.phpfmt.ast.Token;
import org.pragmatica.phpfmt.format.printer.NodeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Format-preserving reprint at top-level statement granularity.
 *
 * A current statement equal to an unused original statement that has a token span is copied from the
 * original tokens, together with the tokens separating it from the original statement before it
 * (whitespace and comments). Any other statement is rendered. Tokens before the first and after the
 * last original statement (open tag, trailing text) are kept.
 */
public final class StatementDiffEngine implements FormatPreservingEngine {
    private static final Logger log = LoggerFactory.getLogger(StatementDiffEngine.class);
    private static final int NONE = -1;
    private static final int RENDERED = -2;

    private StatementDiffEngine() {}

    public static StatementDiffEngine statementDiffEngine() {
        return new StatementDiffEngine();
    }

    @Override
    public String reprint(List<? extends Stmt> stmts,
                          List<? extends Stmt> originalStmts,
                          List<Token> originalTokens,
                          NodeRenderer renderer) {
        var spans = originalStmts.stream()
                                 .map(stmt -> stmt.attributes().span())
                                 .toList();
        var used = new boolean[originalStmts.size()];
        var firstStart = spans.stream()
                              .flatMap(Optional::stream)
                              .mapToInt(SourceSpan::startToken)
                              .min()
                              .orElse(originalTokens.size());
        var lastEnd = spans.stream()
                           .flatMap(Optional::stream)
                           .mapToInt(SourceSpan::endToken)
                           .max()
                           .orElse(firstStart - 1);

        var out = new StringBuilder(tokenText(originalTokens, 0, firstStart));
        int copied = 0;
        int rendered = 0;
        int previousCopy = NONE;

        for (var stmt : stmts) {
            int match = findOriginal(stmt, originalStmts, spans, used);

            if (match >= 0) {
                used[match] = true;
                var span = spans.get(match).orElseThrow();
                int predecessor = predecessor(spans, match);
                int separatorStart = predecessor == NONE
                                     ? firstStart
                                     : spans.get(predecessor).orElseThrow().endToken() + 1;
                var separator = tokenText(originalTokens, separatorStart, span.startToken());
                // Out of original order, or after a rendered statement, the separator may not end the previous line
                if (predecessor != previousCopy && !separator.startsWith("\n") && !endsWithNewline(out)) {
                    separator = "\n" + separator.stripLeading();
                }
                out.append(separator)
                   .append(tokenText(originalTokens, span.startToken(), span.endToken() + 1));
                copied++;
                previousCopy = match;
            } else {
                if (!out.isEmpty() && !endsWithNewline(out)) {
                    out.append('\n');
                }
                out.append(renderer.renderStatements(List.of(stmt)));
                rendered++;
                previousCopy = RENDERED;
            }
        }

        out.append(tokenText(originalTokens, Math.max(lastEnd + 1, firstStart), originalTokens.size()));
        log.debug("Reprinted {} statements preserving format: {} copied, {} rendered", stmts.size(), copied, rendered);
        return out.toString();
    }

    private static int findOriginal(Stmt stmt,
                                    List<? extends Stmt> originalStmts,
                                    List<Optional<SourceSpan>> spans,
                                    boolean[] used) {
        for (int i = 0; i < originalStmts.size(); i++) {
            if (!used[i] && spans.get(i).isPresent() && originalStmts.get(i).equals(stmt)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Closest preceding original statement with a span, or {@link #NONE} for the first one; the header
     * tokens already cover everything before it.
     */
    private static int predecessor(List<Optional<SourceSpan>> spans, int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (spans.get(i).isPresent()) {
                return i;
            }
        }
        return NONE;
    }

    private static boolean endsWithNewline(StringBuilder out) {
        return !out.isEmpty() && out.charAt(out.length() - 1) == '\n';
    }

    private static String tokenText(List<Token> tokens, int from, int to) {
        var sb = new StringBuilder();
        for (int i = Math.max(from, 0); i < Math.min(to, tokens.size()); i++) {
            sb.append(tokens.get(i).text());
        }
        return sb.toString();
    }
}
