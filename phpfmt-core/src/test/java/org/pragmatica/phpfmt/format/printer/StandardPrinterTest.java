package org.pragmatica.phpfmt.format.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.phpfmt.ast.Attributes;
import org.pragmatica.phpfmt.ast.Expr;
import org.pragmatica.phpfmt.ast.Stmt;
import org.pragmatica.phpfmt.ast.StringKind;
import org.pragmatica.phpfmt.format.UnsupportedNodeException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.phpfmt.ast.Nodes.array;
import static org.pragmatica.phpfmt.ast.Nodes.doubleQuoted;
import static org.pragmatica.phpfmt.ast.Nodes.echo;
import static org.pragmatica.phpfmt.ast.Nodes.function;
import static org.pragmatica.phpfmt.ast.Nodes.integer;
import static org.pragmatica.phpfmt.ast.Nodes.interpolated;
import static org.pragmatica.phpfmt.ast.Nodes.item;
import static org.pragmatica.phpfmt.ast.Nodes.param;
import static org.pragmatica.phpfmt.ast.Nodes.returns;
import static org.pragmatica.phpfmt.ast.Nodes.statement;
import static org.pragmatica.phpfmt.ast.Nodes.string;
import static org.pragmatica.phpfmt.ast.Nodes.text;
import static org.pragmatica.phpfmt.ast.Nodes.variable;

class StandardPrinterTest {
    private final StandardPrinter printer = StandardPrinter.standardPrinter();

    @Test
    void renderStatements_placesDeclarationBraceOnNextLine() {
        var fn = function("double_it", List.of(param("a")), returns(variable("a")));

        assertThat(printer.renderStatements(List.of(fn)))
                  .isEqualTo("function double_it($a)\n{\n    return $a;\n}");
    }

    @Test
    void renderStatements_keepsControlBraceOnSameLine() {
        var stmt = new Stmt.If(variable("a"),
                               List.of(echo(integer(1))),
                               List.of(),
                               Optional.of(new Stmt.Else(List.of(echo(integer(2))), Attributes.EMPTY)),
                               Attributes.EMPTY);

        assertThat(printer.renderStatements(List.of(stmt)))
                  .isEqualTo("if ($a) {\n    echo 1;\n} else {\n    echo 2;\n}");
    }

    @Test
    void render_printsArraysOnOneLine() {
        assertThat(printer.render(array(item(string("a"), integer(1)), item(integer(2)))))
                  .isEqualTo("array('a' => 1, 2)");
    }

    @Test
    void render_escapesStringLiterals() {
        assertThat(printer.render(string("it's a \\ test"))).isEqualTo("'it\\'s a \\\\ test'");
        assertThat(printer.render(doubleQuoted("say \"$hi\"\n"))).isEqualTo("\"say \\\"\\$hi\\\"\\n\"");
        assertThat(printer.render(doubleQuoted("\u0001" + "7"))).isEqualTo("\"\\0017\"");
    }

    @Test
    void render_printsHeredocAndNowdoc() {
        var heredoc = new Expr.StringLiteral("Hello $name\nBye", StringKind.HEREDOC, "EOT", Attributes.EMPTY);
        var nowdoc = new Expr.StringLiteral("Raw $text", StringKind.NOWDOC, "RAW", Attributes.EMPTY);
        var clash = new Expr.StringLiteral("EOT\nmore", StringKind.HEREDOC, "EOT", Attributes.EMPTY);

        assertThat(printer.render(heredoc)).isEqualTo("<<<EOT\nHello \\$name\nBye\nEOT");
        assertThat(printer.render(nowdoc)).isEqualTo("<<<'RAW'\nRaw $text\nRAW");
        assertThat(printer.render(clash)).isEqualTo("\"EOT\\nmore\"");
    }

    @Test
    void render_bracesInterpolatedExpressions() {
        assertThat(printer.render(interpolated(text("Hello "), variable("name"), text("!"))))
                  .isEqualTo("\"Hello {$name}!\"");
    }

    @Test
    void render_printsNumbersLikePhp() {
        assertThat(printer.render(integer(Long.MIN_VALUE))).isEqualTo("(-9223372036854775807-1)");
        assertThat(StandardPrinter.formatFloat(1.0)).isEqualTo("1.0");
        assertThat(StandardPrinter.formatFloat(0.1)).isEqualTo("0.1");
        assertThat(StandardPrinter.formatFloat(1e20)).isEqualTo("1.0E+20");
        assertThat(StandardPrinter.formatFloat(Double.POSITIVE_INFINITY)).isEqualTo("\\INF");
    }

    @Test
    void render_failsOnErrorPlaceholder() {
        var broken = statement(new Expr.Error(Attributes.EMPTY));

        assertThatThrownBy(() -> printer.renderStatements(List.of(broken)))
                  .isInstanceOf(UnsupportedNodeException.class)
                  .hasMessageContaining("EXPR_ERROR");
    }
}
