package org.pragmatica.phpfmt.format.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.phpfmt.ast.Attributes;
import org.pragmatica.phpfmt.ast.CastType;
import org.pragmatica.phpfmt.ast.Expr;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.phpfmt.ast.Nodes.assign;
import static org.pragmatica.phpfmt.ast.Nodes.binary;
import static org.pragmatica.phpfmt.ast.Nodes.cast;
import static org.pragmatica.phpfmt.ast.Nodes.variable;

class PrecedenceTest {
    private final StandardPrinter printer = StandardPrinter.standardPrinter();

    private static final Expr A = variable("a");
    private static final Expr B = variable("b");
    private static final Expr C = variable("c");

    @Test
    void render_parenthesizesLooserOperand() {
        assertThat(printer.render(binary("*", binary("+", A, B), C))).isEqualTo("($a + $b) * $c");
        assertThat(printer.render(binary("+", binary("*", A, B), C))).isEqualTo("$a * $b + $c");
    }

    @Test
    void render_followsAssociativity() {
        assertThat(printer.render(binary("-", binary("-", A, B), C))).isEqualTo("$a - $b - $c");
        assertThat(printer.render(binary("-", A, binary("-", B, C)))).isEqualTo("$a - ($b - $c)");
        assertThat(printer.render(binary("**", A, binary("**", B, C)))).isEqualTo("$a ** $b ** $c");
        assertThat(printer.render(assign(A, assign(B, C)))).isEqualTo("$a = $b = $c");
        assertThat(printer.render(binary("??", A, binary("??", B, C)))).isEqualTo("$a ?? $b ?? $c");
    }

    @Test
    void render_parenthesizesNonAssociativeChains() {
        assertThat(printer.render(binary("==", binary("==", A, B), C))).isEqualTo("($a == $b) == $c");

        var inner = new Expr.Ternary(A, Optional.of(B), C, Attributes.EMPTY);
        var outer = new Expr.Ternary(inner, Optional.of(variable("x")), variable("y"), Attributes.EMPTY);
        assertThat(printer.render(outer)).isEqualTo("($a ? $b : $c) ? $x : $y");
    }

    @Test
    void render_keepsUnaryOperatorsApart() {
        var negated = new Expr.UnaryOp("-", new Expr.UnaryOp("-", A, false, Attributes.EMPTY), false, Attributes.EMPTY);
        var increment = new Expr.UnaryOp("++", A, true, Attributes.EMPTY);

        assertThat(printer.render(negated)).isEqualTo("-(-$a)");
        assertThat(printer.render(increment)).isEqualTo("$a++");
        assertThat(printer.render(new Expr.UnaryOp("!", binary("&&", A, B), false, Attributes.EMPTY)))
                  .isEqualTo("!($a && $b)");
    }

    @Test
    void render_parenthesizesCastOperand() {
        assertThat(printer.render(cast(CastType.INT, binary("+", A, B)))).isEqualTo("(int) ($a + $b)");
        assertThat(printer.render(binary("+", cast(CastType.INT, A), B))).isEqualTo("(int) $a + $b");
    }

    @Test
    void binary_rejectsUnknownOperator() {
        assertThatThrownBy(() -> Precedence.binary("<<<"))
                  .isInstanceOf(IllegalArgumentException.class);
        assertThat(Precedence.binary("AND")).isEqualTo(Precedence.binary("and"));
    }
}
