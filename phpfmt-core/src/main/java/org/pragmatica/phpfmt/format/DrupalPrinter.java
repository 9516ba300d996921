package org.pragmatica.phpfmt.format;

import org.pragmatica.phpfmt.ast.PhpNode;
import org.pragmatica.phpfmt.ast.Stmt;
import org.pragmatica.phpfmt.ast.Token;
import org.pragmatica.phpfmt.format.printer.DrupalNodeRenderer;
import org.pragmatica.phpfmt.format.printer.Markup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Prints PHP syntax trees in Drupal coding style, optionally annotated with HTML spans.
 *
 * A printer keeps render state between calls and must not be used from several threads at once;
 * separate printers are independent.
 */
public final class DrupalPrinter {
    private static final Logger log = LoggerFactory.getLogger(DrupalPrinter.class);

    private static final String OPEN_TAG = "<?php";
    private static final String CLOSE_TAG = "?>";
    private static final Pattern TRAILING_SPACES = Pattern.compile(" +$", Pattern.MULTILINE);

    private final PrinterConfig config;
    private final DrupalNodeRenderer renderer;
    private final FormatPreservingEngine engine;
    private final Optional<Snapshot> original;

    private record Snapshot(List<Stmt> stmts, List<Token> tokens) {}

    private DrupalPrinter(PrinterConfig config, FormatPreservingEngine engine, Optional<Snapshot> original) {
        this.config = config;
        this.renderer = DrupalNodeRenderer.drupalNodeRenderer(config);
        this.engine = engine;
        this.original = original;
    }

    /**
     * Factory method to create a Drupal printer.
     */
    public static DrupalPrinter drupalPrinter(PrinterConfig config) {
        return new DrupalPrinter(config, StatementDiffEngine.statementDiffEngine(), Optional.empty());
    }

    /**
     * Printer that remembers a parsed file, so that {@link #renderPreservingFormat(List)} can reprint a
     * modified copy of its statements keeping unchanged source text.
     */
    public static DrupalPrinter forFormatPreserving(List<? extends Stmt> originalStmts,
                                                    List<Token> originalTokens,
                                                    PrinterConfig config) {
        var snapshot = new Snapshot(List.copyOf(originalStmts), List.copyOf(originalTokens));
        return new DrupalPrinter(config, StatementDiffEngine.statementDiffEngine(), Optional.of(snapshot));
    }

    public PrinterConfig config() {
        return config;
    }

    /**
     * Renders a complete file: open tag, blank line, statements.
     */
    public String render(List<? extends Stmt> stmts) {
        var openTag = config.annotate()
                      ? Markup.span(Markup.BOUNDARY, Markup.escape(OPEN_TAG))
                      : OPEN_TAG;
        var closeTag = config.annotate()
                       ? Markup.span(Markup.BOUNDARY, Markup.escape(CLOSE_TAG))
                       : CLOSE_TAG;

        log.debug("Rendering {} statements (annotate={}, drupalMode={})",
                  stmts.size(), config.annotate(), config.drupalMode());

        if (stmts.isEmpty()) {
            return config.annotate()
                   ? openTag + "\n\n"
                   : openTag + "\n\n\n";
        }

        var text = openTag + "\n\n" + renderer.renderStatements(stmts);

        if (stmts.get(0) instanceof Stmt.InlineHtml) {
            text = Pattern.compile("^" + Pattern.quote(openTag) + "\\s+" + Pattern.quote(closeTag) + "\\n?")
                          .matcher(text)
                          .replaceFirst("");
        }
        if (stmts.get(stmts.size() - 1) instanceof Stmt.InlineHtml) {
            text = Pattern.compile(Pattern.quote(openTag) + "$")
                          .matcher(text.stripTrailing())
                          .replaceFirst("");
        }
        if (!config.annotate()) {
            text = text + "\n";
        }
        return stripTrailingSpaces(text);
    }

    /**
     * Renders statements without the open tag.
     */
    public String renderStatements(List<? extends Stmt> stmts) {
        return stripTrailingSpaces(renderer.renderStatements(stmts));
    }

    /**
     * Renders a single node, such as an expression, at zero indentation.
     */
    public String render(PhpNode node) {
        return renderer.renderNode(node);
    }

    /**
     * Reprints a modified copy of the statements this printer was created with.
     *
     * @throws IllegalStateException if the printer was not created by {@link #forFormatPreserving}
     */
    public String renderPreservingFormat(List<? extends Stmt> stmts) {
        var snapshot = original.orElseThrow(
                () -> new IllegalStateException("Printer was not created for format-preserving printing"));
        return renderPreservingFormat(stmts, snapshot.stmts(), snapshot.tokens());
    }

    public String renderPreservingFormat(List<? extends Stmt> stmts,
                                         List<? extends Stmt> originalStmts,
                                         List<Token> originalTokens) {
        return engine.reprint(stmts, originalStmts, originalTokens, renderer);
    }

    private static String stripTrailingSpaces(String text) {
        return TRAILING_SPACES.matcher(text).replaceAll("");
    }
}
