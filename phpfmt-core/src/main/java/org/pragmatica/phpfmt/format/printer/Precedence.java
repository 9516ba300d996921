package org.pragmatica.phpfmt.format.printer;

import org.pragmatica.phpfmt.ast.Expr;
import org.pragmatica.phpfmt.ast.PhpNode;

import java.util.Map;
import java.util.Optional;

import static org.pragmatica.phpfmt.format.printer.PrecedenceContext.LEFT;
import static org.pragmatica.phpfmt.format.printer.PrecedenceContext.NON_ASSOCIATIVE;
import static org.pragmatica.phpfmt.format.printer.PrecedenceContext.RIGHT;

/**
 * PHP operator precedence. Lower numbers bind tighter.
 */
public final class Precedence {

    public record Level(int precedence, int associativity) {}

    public static final Level POW = new Level(20, RIGHT);
    public static final Level UNARY = new Level(30, RIGHT);
    public static final Level POSTFIX = new Level(30, LEFT);
    public static final Level INSTANCEOF = new Level(40, NON_ASSOCIATIVE);
    public static final Level NOT = new Level(50, RIGHT);
    public static final Level TERNARY = new Level(170, NON_ASSOCIATIVE);
    public static final Level ASSIGN = new Level(180, RIGHT);
    public static final Level PRINT = new Level(190, RIGHT);
    public static final Level INCLUDE = new Level(230, LEFT);

    private static final Map<String, Level> BINARY = Map.ofEntries(
            Map.entry("**", POW),
            Map.entry("*", new Level(60, LEFT)),
            Map.entry("/", new Level(60, LEFT)),
            Map.entry("%", new Level(60, LEFT)),
            Map.entry("+", new Level(70, LEFT)),
            Map.entry("-", new Level(70, LEFT)),
            Map.entry(".", new Level(70, LEFT)),
            Map.entry("<<", new Level(80, LEFT)),
            Map.entry(">>", new Level(80, LEFT)),
            Map.entry("<", new Level(90, NON_ASSOCIATIVE)),
            Map.entry("<=", new Level(90, NON_ASSOCIATIVE)),
            Map.entry(">", new Level(90, NON_ASSOCIATIVE)),
            Map.entry(">=", new Level(90, NON_ASSOCIATIVE)),
            Map.entry("==", new Level(100, NON_ASSOCIATIVE)),
            Map.entry("!=", new Level(100, NON_ASSOCIATIVE)),
            Map.entry("<>", new Level(100, NON_ASSOCIATIVE)),
            Map.entry("===", new Level(100, NON_ASSOCIATIVE)),
            Map.entry("!==", new Level(100, NON_ASSOCIATIVE)),
            Map.entry("<=>", new Level(100, NON_ASSOCIATIVE)),
            Map.entry("&", new Level(110, LEFT)),
            Map.entry("^", new Level(120, LEFT)),
            Map.entry("|", new Level(130, LEFT)),
            Map.entry("&&", new Level(140, LEFT)),
            Map.entry("||", new Level(150, LEFT)),
            Map.entry("??", new Level(160, RIGHT)),
            Map.entry("and", new Level(200, LEFT)),
            Map.entry("xor", new Level(210, LEFT)),
            Map.entry("or", new Level(220, LEFT)));

    private Precedence() {}

    public static Level binary(String operator) {
        var level = BINARY.get(operator.toLowerCase());
        if (level == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + operator);
        }
        return level;
    }

    public static Level unary(Expr.UnaryOp node) {
        if (node.postfix()) {
            return POSTFIX;
        }
        return "!".equals(node.operator()) ? NOT : UNARY;
    }

    /**
     * Precedence of the operator at the root of {@code node}; empty for nodes that are not operators.
     */
    public static Optional<Level> of(PhpNode node) {
        return switch (node.kind()) {
            case EXPR_BINARY_OP -> Optional.of(binary(((Expr.BinaryOp) node).operator()));
            case EXPR_UNARY_OP -> Optional.of(unary((Expr.UnaryOp) node));
            case EXPR_CAST -> Optional.of(UNARY);
            case EXPR_INSTANCEOF -> Optional.of(INSTANCEOF);
            case EXPR_TERNARY -> Optional.of(TERNARY);
            case EXPR_ASSIGN, EXPR_ASSIGN_REF, EXPR_ASSIGN_OP -> Optional.of(ASSIGN);
            case EXPR_PRINT -> Optional.of(PRINT);
            case EXPR_INCLUDE -> Optional.of(INCLUDE);
            default -> Optional.empty();
        };
    }

    /**
     * Whether {@code node} must be wrapped in parentheses when rendered at {@code context}.
     */
    public static boolean needsParentheses(PhpNode node, PrecedenceContext context) {
        return of(node).map(level -> level.precedence() > context.precedence()
                                     || (level.precedence() == context.precedence()
                                         && context.associativity() != context.position()))
                       .orElse(false);
    }
}
