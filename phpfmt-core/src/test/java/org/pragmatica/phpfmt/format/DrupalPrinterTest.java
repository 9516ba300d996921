package org.pragmatica.phpfmt.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.phpfmt.ast.Attributes;
import org.pragmatica.phpfmt.ast.Stmt;
import org.pragmatica.phpfmt.ast.Token;
import org.pragmatica.phpfmt.format.printer.Markup;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.phpfmt.ast.Nodes.assign;
import static org.pragmatica.phpfmt.ast.Nodes.echo;
import static org.pragmatica.phpfmt.ast.Nodes.function;
import static org.pragmatica.phpfmt.ast.Nodes.integer;
import static org.pragmatica.phpfmt.ast.Nodes.statement;
import static org.pragmatica.phpfmt.ast.Nodes.variable;
import static org.pragmatica.phpfmt.format.DrupalPrinter.drupalPrinter;

class DrupalPrinterTest {
    private final DrupalPrinter printer = drupalPrinter(PrinterConfig.defaultConfig());
    private final DrupalPrinter htmlPrinter = drupalPrinter(PrinterConfig.defaultConfig().withAnnotate(true));

    @Test
    void render_printsOpenTagForEmptyFile() {
        assertThat(printer.render(List.of())).isEqualTo("<?php\n\n\n");
        assertThat(htmlPrinter.render(List.of())).isEqualTo("<span class=\"php-boundary\">&lt;?php</span>\n\n");
    }

    @Test
    void render_separatesOpenTagWithBlankLineAndEndsWithNewline() {
        var stmts = List.of(statement(assign(variable("a"), integer(1))));

        assertThat(printer.render(stmts)).isEqualTo("<?php\n\n$a = 1;\n");
        assertThat(htmlPrinter.render(stmts))
                  .startsWith("<span class=\"php-boundary\">&lt;?php</span>\n\n")
                  .endsWith(";");
    }

    @Test
    void render_keepsBlankLineAfterFileDocBlock() {
        var stmts = List.of(statement(assign(variable("a"), integer(1)), "/**\n * @file\n * Example.\n */"));

        assertThat(printer.render(stmts)).isEqualTo("<?php\n\n/**\n * @file\n * Example.\n */\n\n$a = 1;\n");
    }

    @Test
    void render_stripsTrailingSpacesFromBlankLines() {
        var fn = function("f",
                          List.of(),
                          statement(variable("a")),
                          statement(variable("b"), "/*\n * Block.\n */"));

        assertThat(printer.render(List.of(fn)))
                  .isEqualTo("<?php\n\nfunction f() {\n  $a;\n\n  /*\n   * Block.\n   */\n  $b;\n}\n");
    }

    @Test
    void render_dropsBoundaryBeforeLeadingInlineHtml() {
        var stmts = List.of(new Stmt.InlineHtml("<div>\n", false, Attributes.EMPTY), echo(integer(1)));

        assertThat(printer.render(stmts)).isEqualTo("<div>\n<?php\necho 1;\n");
    }

    @Test
    void render_isRepeatable() {
        var stmts = List.of(function("f", List.of(), echo(integer(1))));

        assertThat(htmlPrinter.render(stmts)).isEqualTo(htmlPrinter.render(stmts));
        assertThat(printer.render(stmts)).isEqualTo(printer.render(stmts));
    }

    @Test
    void render_annotatedTextReducesToPlainText() {
        var stmts = List.<Stmt>of(function("f", List.of(), echo(integer(1)), statement(variable("x"), "// Note.")));

        assertThat(Markup.plainText(htmlPrinter.render(stmts)) + "\n").isEqualTo(printer.render(stmts));
    }

    @Test
    void renderPreservingFormat_requiresSnapshot() {
        assertThatThrownBy(() -> printer.renderPreservingFormat(List.of()))
                  .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void renderPreservingFormat_reprintsAgainstSnapshot() {
        var original = new Stmt.Expression(assign(variable("a"), integer(1)), Attributes.spanning(1, 1));
        var tokens = List.of(new Token("<?php\n"), new Token("$a=1;"), new Token("\n"));
        var preserving = DrupalPrinter.forFormatPreserving(List.of(original), tokens, PrinterConfig.defaultConfig());

        assertThat(preserving.renderPreservingFormat(List.of(original))).isEqualTo("<?php\n$a=1;\n");
        assertThat(preserving.renderPreservingFormat(List.of(original, echo(variable("a")))))
                  .isEqualTo("<?php\n$a=1;\necho $a;\n");
    }
}
