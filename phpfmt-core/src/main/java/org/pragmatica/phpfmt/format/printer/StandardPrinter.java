package org.pragmatica.phpfmt.format.printer;

import org.pragmatica.phpfmt.ast.Arg;
import org.pragmatica.phpfmt.ast.ArrayItem;
import org.pragmatica.phpfmt.ast.ArrayKind;
import org.pragmatica.phpfmt.ast.ClosureUse;
import org.pragmatica.phpfmt.ast.Comment;
import org.pragmatica.phpfmt.ast.ConstDecl;
import org.pragmatica.phpfmt.ast.Expr;
import org.pragmatica.phpfmt.ast.Identifier;
import org.pragmatica.phpfmt.ast.InterpolatedStringPart;
import org.pragmatica.phpfmt.ast.Modifier;
import org.pragmatica.phpfmt.ast.Name;
import org.pragmatica.phpfmt.ast.NodeKind;
import org.pragmatica.phpfmt.ast.NodeVisitor;
import org.pragmatica.phpfmt.ast.NullableType;
import org.pragmatica.phpfmt.ast.Param;
import org.pragmatica.phpfmt.ast.PhpNode;
import org.pragmatica.phpfmt.ast.PropertyItem;
import org.pragmatica.phpfmt.ast.StaticVar;
import org.pragmatica.phpfmt.ast.Stmt;
import org.pragmatica.phpfmt.ast.StringKind;
import org.pragmatica.phpfmt.ast.UseItem;
import org.pragmatica.phpfmt.ast.UseType;
import org.pragmatica.phpfmt.format.UnsupportedNodeException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.pragmatica.phpfmt.format.printer.PrecedenceContext.leftOf;
import static org.pragmatica.phpfmt.format.printer.PrecedenceContext.rightOf;

/**
 * Generic PHP printer: one visit method per node kind, rendering the way PHP-Parser's standard
 * pretty printer does. Brace on the next line for declarations, on the same line for control
 * structures, arrays on one line.
 *
 * Children are always rendered through {@link #render(PhpNode, PrecedenceContext)}, so a subclass
 * overriding a visit method changes that node kind at every depth.
 */
public class StandardPrinter implements NodeVisitor<String>, NodeRenderer {
    private static final Pattern LABEL_CHAR = Pattern.compile("[_A-Za-z0-9\\x{80}-\\x{10FFFF}]");

    protected final IndentationTracker indentation;
    protected final boolean shortArraySyntax;

    private boolean semicolonNamespaces = true;

    public StandardPrinter(IndentationTracker indentation, boolean shortArraySyntax) {
        this.indentation = indentation;
        this.shortArraySyntax = shortArraySyntax;
    }

    public static StandardPrinter standardPrinter() {
        return new StandardPrinter(IndentationTracker.indentationTracker(IndentationTracker.STANDARD_UNIT), false);
    }

    // ===== Entry points =====

    @Override
    public String render(PhpNode node) {
        return render(node, PrecedenceContext.NONE);
    }

    @Override
    public String render(PhpNode node, PrecedenceContext context) {
        var text = node.accept(this);
        return Precedence.needsParentheses(node, context)
               ? "(" + text + ")"
               : text;
    }

    @Override
    public String renderNode(PhpNode node) {
        try (var pass = beginPass()) {
            indentation.reset();
            return render(node);
        }
    }

    @Override
    public String renderStatements(List<? extends Stmt> stmts) {
        try (var pass = beginPass()) {
            indentation.reset();
            semicolonNamespaces = stmts.stream()
                                       .noneMatch(stmt -> stmt instanceof Stmt.Namespace namespace
                                                          && namespace.name().isEmpty());
            return renderBlock(stmts, false).stripLeading();
        }
    }

    /**
     * Hook run around a top-level pass.
     */
    protected Scope beginPass() {
        return () -> {};
    }

    // ===== Shared building blocks =====

    protected String newline() {
        return indentation.newline();
    }

    /**
     * Statements, each on its own line preceded by its comments; one level deeper if {@code indent}.
     */
    public String renderBlock(List<? extends Stmt> stmts, boolean indent) {
        Scope scope = indent
                      ? indentation.indented()
                      : () -> {};

        try (scope) {
            var sb = new StringBuilder();
            for (var stmt : stmts) {
                var comments = stmt.comments();
                if (!comments.isEmpty()) {
                    sb.append(newline()).append(renderComments(comments));
                    if (stmt instanceof Stmt.Nop) {
                        continue;
                    }
                }
                sb.append(newline()).append(render(stmt));
            }
            return sb.toString();
        }
    }

    protected String renderComments(List<Comment> comments) {
        return comments.stream()
                       .map(comment -> comment.reformattedText().replace("\n", newline()))
                       .collect(Collectors.joining(newline()));
    }

    public String renderCommaSeparated(List<? extends PhpNode> nodes) {
        return implode(nodes, ", ");
    }

    protected String implode(List<? extends PhpNode> nodes, String glue) {
        return nodes.stream()
                    .map(this::render)
                    .collect(Collectors.joining(glue));
    }

    /**
     * Printer-generated operator text; annotated output escapes it.
     */
    protected String token(String text) {
        return text;
    }

    protected String infix(Precedence.Level level, PhpNode left, String operator, PhpNode right) {
        return render(left, leftOf(level)) + token(operator) + render(right, rightOf(level));
    }

    protected String prefix(Precedence.Level level, String operator, PhpNode operand) {
        return operator + render(operand, rightOf(level));
    }

    protected String postfix(Precedence.Level level, PhpNode operand, String operator) {
        return render(operand, leftOf(level)) + operator;
    }

    protected String modifiers(Set<Modifier> modifiers) {
        return Modifier.render(modifiers);
    }

    protected String useType(UseType type) {
        var keyword = type.keyword();
        return keyword.isEmpty()
               ? ""
               : keyword + " ";
    }

    protected String returnType(Optional<PhpNode> type) {
        return type.map(t -> " : " + render(t))
                   .orElse("");
    }

    protected String body(List<? extends Stmt> stmts) {
        return "{" + renderBlock(stmts, true) + newline() + "}";
    }

    /**
     * Callee of a function call, parenthesized unless it is a name or a directly callable expression.
     */
    protected String callLhs(PhpNode node) {
        return switch (node.kind()) {
            case NAME, EXPR_VARIABLE, EXPR_ARRAY_DIM_FETCH, EXPR_FUNC_CALL, EXPR_METHOD_CALL, EXPR_STATIC_CALL,
                 EXPR_ARRAY_LITERAL -> render(node);
            default -> "(" + render(node) + ")";
        };
    }

    /**
     * Receiver of {@code ->}, {@code ::} or {@code []}.
     */
    protected String dereferenceLhs(PhpNode node) {
        return switch (node.kind()) {
            case NAME, EXPR_VARIABLE, EXPR_ARRAY_DIM_FETCH, EXPR_PROPERTY_FETCH, EXPR_STATIC_PROPERTY_FETCH,
                 EXPR_FUNC_CALL, EXPR_METHOD_CALL, EXPR_STATIC_CALL, EXPR_ARRAY_LITERAL, EXPR_STRING_LITERAL,
                 EXPR_CONST_FETCH, EXPR_CLASS_CONST_FETCH -> render(node);
            default -> "(" + render(node) + ")";
        };
    }

    protected String newVariable(PhpNode node) {
        return switch (node.kind()) {
            case NAME, EXPR_VARIABLE, EXPR_ARRAY_DIM_FETCH, EXPR_PROPERTY_FETCH, EXPR_STATIC_PROPERTY_FETCH ->
                    render(node);
            default -> "(" + render(node) + ")";
        };
    }

    /**
     * Member name after {@code ->}: plain for identifiers, braced for expressions.
     */
    protected String objectProperty(PhpNode node) {
        return node instanceof Identifier identifier
               ? identifier.name()
               : "{" + render(node) + "}";
    }

    protected String staticMemberName(PhpNode node) {
        if (node instanceof Identifier identifier) {
            return identifier.name();
        }
        return node instanceof Expr.Variable
               ? render(node)
               : "{" + render(node) + "}";
    }

    protected ArrayKind arraySyntax(Expr.ArrayLiteral node) {
        if (node.syntax() != ArrayKind.UNSPECIFIED) {
            return node.syntax();
        }
        return shortArraySyntax
               ? ArrayKind.SHORT
               : ArrayKind.LONG;
    }

    protected String encapsList(List<PhpNode> parts, Character quote) {
        var sb = new StringBuilder();
        for (var part : parts) {
            if (part instanceof InterpolatedStringPart text) {
                sb.append(escapeString(text.value(), quote));
            } else {
                sb.append('{').append(render(part)).append('}');
            }
        }
        return sb.toString();
    }

    protected String classCommon(Stmt.ClassDecl node, String afterClassToken) {
        return modifiers(node.modifiers())
               + "class" + afterClassToken
               + node.extendsClass().map(name -> " extends " + render(name)).orElse("")
               + (node.implementsList().isEmpty() ? "" : " implements " + renderCommaSeparated(node.implementsList()))
               + newline() + body(node.stmts());
    }

    // ===== String escaping =====

    /**
     * Escapes {@code value} for a double-quoted string ({@code quote} is {@code '"'}) or a heredoc
     * body ({@code quote} is {@code null}, newlines kept).
     */
    public static String escapeString(String value, Character quote) {
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> sb.append(quote == null ? "\n" : "\\n");
                case '\r' -> sb.append(quote == null ? "\r" : "\\r");
                case '\t' -> sb.append("\\t");
                case '\f' -> sb.append("\\f");
                case '\u000B' -> sb.append("\\v");
                case '$' -> sb.append("\\$");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (quote != null && c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20) {
                        sb.append(octalEscape(c, i + 1 < value.length() ? value.charAt(i + 1) : ' '));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static String octalEscape(char c, char next) {
        var octal = Integer.toOctalString(c);
        // A following octal digit would be read as part of the escape
        if (next >= '0' && next <= '7') {
            octal = "0".repeat(3 - octal.length()) + octal;
        }
        return "\\" + octal;
    }

    public static String escapeSingleQuoted(String value) {
        return value.replace("\\", "\\\\")
                    .replace("'", "\\'");
    }

    private static boolean containsEndLabel(String value, String label) {
        var pattern = Pattern.compile("(?:^|[\\r\\n])" + Pattern.quote(label) + "(?:$|[^_A-Za-z0-9\\x{80}-\\x{10FFFF}])");
        return value.contains(label) && pattern.matcher(value).find();
    }

    private static boolean isUsableLabel(String label) {
        return !label.isEmpty() && LABEL_CHAR.matcher(label.substring(0, 1)).matches();
    }

    static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "\\NAN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "\\INF" : "-\\INF";
        }

        var decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;

        if (value != 0 && (exponent < -4 || exponent >= 16)) {
            var mantissa = decimal.movePointLeft(exponent).toPlainString();
            if (!mantissa.contains(".")) {
                mantissa = mantissa + ".0";
            }
            return mantissa + "E" + (exponent < 0 ? "-" : "+") + Math.abs(exponent);
        }

        var plain = decimal.toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    // ===== Support nodes =====

    @Override
    public String visit(Name node) {
        return node.asString();
    }

    @Override
    public String visit(Identifier node) {
        return node.name();
    }

    @Override
    public String visit(NullableType node) {
        return "?" + render(node.type());
    }

    @Override
    public String visit(Param node) {
        return node.type().map(type -> render(type) + " ").orElse("")
               + (node.byRef() ? token("&") : "")
               + (node.variadic() ? "..." : "")
               + render(node.var())
               + node.defaultValue().map(value -> " = " + render(value)).orElse("");
    }

    @Override
    public String visit(Arg node) {
        return node.name().map(name -> name.name() + ": ").orElse("")
               + (node.byRef() ? token("&") : "")
               + (node.unpack() ? "..." : "")
               + render(node.value());
    }

    @Override
    public String visit(ArrayItem node) {
        return node.key().map(key -> render(key) + token(" => ")).orElse("")
               + (node.byRef() ? token("&") : "")
               + (node.unpack() ? "..." : "")
               + render(node.value());
    }

    @Override
    public String visit(InterpolatedStringPart node) {
        return escapeString(node.value(), '"');
    }

    @Override
    public String visit(ClosureUse node) {
        return (node.byRef() ? token("&") : "") + render(node.var());
    }

    @Override
    public String visit(ConstDecl node) {
        return node.name().name() + " = " + render(node.value());
    }

    @Override
    public String visit(StaticVar node) {
        return render(node.var())
               + node.defaultValue().map(value -> " = " + render(value)).orElse("");
    }

    @Override
    public String visit(UseItem node) {
        return useType(node.type())
               + render(node.name())
               + node.alias().map(alias -> " as " + alias.name()).orElse("");
    }

    @Override
    public String visit(PropertyItem node) {
        return "$" + node.name()
               + node.defaultValue().map(value -> " = " + render(value)).orElse("");
    }

    // ===== Scalars =====

    @Override
    public String visit(Expr.StringLiteral node) {
        var label = node.docLabel();
        var value = node.value();

        if (node.quoting() == StringKind.NOWDOC && isUsableLabel(label) && !containsEndLabel(value, label)) {
            return "<<<'" + label + "'\n" + (value.isEmpty() ? "" : value + "\n") + label;
        }
        if (node.quoting() == StringKind.HEREDOC && isUsableLabel(label) && !containsEndLabel(value, label)) {
            return "<<<" + label + "\n" + (value.isEmpty() ? "" : escapeString(value, null) + "\n") + label;
        }
        if (node.quoting() == StringKind.DOUBLE_QUOTED || node.quoting() == StringKind.HEREDOC) {
            return "\"" + escapeString(value, '"') + "\"";
        }
        return "'" + escapeSingleQuoted(value) + "'";
    }

    @Override
    public String visit(Expr.InterpolatedString node) {
        var label = node.docLabel();

        if (node.quoting() == StringKind.HEREDOC && isUsableLabel(label)) {
            if (node.parts().size() == 1
                && node.parts().get(0) instanceof InterpolatedStringPart text
                && text.value().isEmpty()) {
                return "<<<" + label + "\n" + label;
            }
            return "<<<" + label + "\n" + encapsList(node.parts(), null) + "\n" + label;
        }
        return "\"" + encapsList(node.parts(), '"') + "\"";
    }

    @Override
    public String visit(Expr.IntLiteral node) {
        if (node.value() == Long.MIN_VALUE) {
            return "(-" + Long.MAX_VALUE + "-1)";
        }
        return Long.toString(node.value());
    }

    @Override
    public String visit(Expr.FloatLiteral node) {
        return formatFloat(node.value());
    }

    @Override
    public String visit(Expr.MagicConst node) {
        return node.constant().token();
    }

    // ===== Expressions =====

    @Override
    public String visit(Expr.Variable node) {
        return "$" + node.name();
    }

    @Override
    public String visit(Expr.Assign node) {
        return infix(Precedence.ASSIGN, node.var(), " = ", node.expr());
    }

    @Override
    public String visit(Expr.AssignRef node) {
        return infix(Precedence.ASSIGN, node.var(), " =& ", node.expr());
    }

    @Override
    public String visit(Expr.AssignOp node) {
        return infix(Precedence.ASSIGN, node.var(), " " + node.operator() + "= ", node.expr());
    }

    @Override
    public String visit(Expr.BinaryOp node) {
        return infix(Precedence.binary(node.operator()), node.left(), " " + node.operator() + " ", node.right());
    }

    @Override
    public String visit(Expr.UnaryOp node) {
        var level = Precedence.unary(node);
        if (node.postfix()) {
            return postfix(level, node.expr(), node.operator());
        }

        var operand = render(node.expr(), rightOf(level));
        // "- -$a" must not collapse into "--$a"
        if (("-".equals(node.operator()) || "+".equals(node.operator()))
            && Markup.plainText(operand).startsWith(node.operator())) {
            return node.operator() + "(" + operand + ")";
        }
        return node.operator() + operand;
    }

    @Override
    public String visit(Expr.Ternary node) {
        var middle = node.ifTrue()
                         .map(ifTrue -> " ? " + render(ifTrue) + " : ")
                         .orElse(" ?: ");
        return render(node.cond(), leftOf(Precedence.TERNARY)) + middle
               + render(node.ifFalse(), rightOf(Precedence.TERNARY));
    }

    @Override
    public String visit(Expr.Instanceof node) {
        return render(node.expr(), leftOf(Precedence.INSTANCEOF)) + " instanceof " + newVariable(node.classRef());
    }

    @Override
    public String visit(Expr.FuncCall node) {
        return callLhs(node.name()) + "(" + renderCommaSeparated(node.args()) + ")";
    }

    @Override
    public String visit(Expr.MethodCall node) {
        return dereferenceLhs(node.var())
               + token(node.nullsafe() ? "?->" : "->")
               + objectProperty(node.name())
               + "(" + renderCommaSeparated(node.args()) + ")";
    }

    @Override
    public String visit(Expr.StaticCall node) {
        return dereferenceLhs(node.classRef())
               + "::" + staticMemberName(node.name())
               + "(" + renderCommaSeparated(node.args()) + ")";
    }

    @Override
    public String visit(Expr.PropertyFetch node) {
        return dereferenceLhs(node.var())
               + token(node.nullsafe() ? "?->" : "->")
               + objectProperty(node.name());
    }

    @Override
    public String visit(Expr.StaticPropertyFetch node) {
        return dereferenceLhs(node.classRef()) + "::$" + objectProperty(node.name());
    }

    @Override
    public String visit(Expr.ClassConstFetch node) {
        return dereferenceLhs(node.classRef()) + "::" + node.name().name();
    }

    @Override
    public String visit(Expr.ConstFetch node) {
        return render(node.name());
    }

    @Override
    public String visit(Expr.ArrayDimFetch node) {
        return dereferenceLhs(node.var())
               + "[" + node.dim().map(this::render).orElse("") + "]";
    }

    @Override
    public String visit(Expr.ArrayLiteral node) {
        var items = renderCommaSeparated(node.items());
        return arraySyntax(node) == ArrayKind.SHORT
               ? "[" + items + "]"
               : "array(" + items + ")";
    }

    @Override
    public String visit(Expr.ListExpr node) {
        var items = renderCommaSeparated(node.items());
        return node.shortSyntax()
               ? "[" + items + "]"
               : "list(" + items + ")";
    }

    @Override
    public String visit(Expr.New node) {
        if (node.classRef() instanceof Stmt.ClassDecl anonymous) {
            var args = node.args().isEmpty()
                       ? ""
                       : "(" + renderCommaSeparated(node.args()) + ")";
            return "new " + classCommon(anonymous, args);
        }
        return "new " + newVariable(node.classRef()) + "(" + renderCommaSeparated(node.args()) + ")";
    }

    @Override
    public String visit(Expr.Clone node) {
        return "clone " + render(node.expr());
    }

    @Override
    public String visit(Expr.Isset node) {
        return "isset(" + renderCommaSeparated(node.vars()) + ")";
    }

    @Override
    public String visit(Expr.Empty node) {
        return "empty(" + render(node.expr()) + ")";
    }

    @Override
    public String visit(Expr.Eval node) {
        return "eval(" + render(node.expr()) + ")";
    }

    @Override
    public String visit(Expr.Include node) {
        return prefix(Precedence.INCLUDE, node.type().keyword() + " ", node.expr());
    }

    @Override
    public String visit(Expr.Exit node) {
        return (node.die() ? "die" : "exit")
               + node.expr().map(expr -> "(" + render(expr) + ")").orElse("");
    }

    @Override
    public String visit(Expr.Print node) {
        return prefix(Precedence.PRINT, "print ", node.expr());
    }

    @Override
    public String visit(Expr.Closure node) {
        return (node.isStatic() ? "static " : "")
               + "function " + (node.byRef() ? token("&") : "")
               + "(" + renderCommaSeparated(node.params()) + ")"
               + (node.uses().isEmpty() ? "" : " use(" + renderCommaSeparated(node.uses()) + ")")
               + returnType(node.returnType())
               + " " + body(node.stmts());
    }

    @Override
    public String visit(Expr.ArrowFunction node) {
        return (node.isStatic() ? "static " : "")
               + "fn" + (node.byRef() ? token("&") : "")
               + "(" + renderCommaSeparated(node.params()) + ")"
               + returnType(node.returnType())
               + token(" => ") + render(node.expr());
    }

    @Override
    public String visit(Expr.Cast node) {
        return prefix(Precedence.UNARY, "(" + node.type().keyword() + ") ", node.expr());
    }

    @Override
    public String visit(Expr.Error node) {
        throw new UnsupportedNodeException(NodeKind.EXPR_ERROR);
    }

    // ===== Statements =====

    @Override
    public String visit(Stmt.Echo node) {
        return "echo " + renderCommaSeparated(node.exprs()) + ";";
    }

    @Override
    public String visit(Stmt.Return node) {
        return "return" + node.expr().map(expr -> " " + render(expr)).orElse("") + ";";
    }

    @Override
    public String visit(Stmt.If node) {
        return "if (" + render(node.cond()) + ") " + body(node.stmts())
               + (node.elseifs().isEmpty() ? "" : " " + implode(node.elseifs(), " "))
               + node.otherwise().map(otherwise -> " " + render(otherwise)).orElse("");
    }

    @Override
    public String visit(Stmt.ElseIf node) {
        return "elseif (" + render(node.cond()) + ") " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.Else node) {
        return "else " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.For node) {
        return "for ("
               + renderCommaSeparated(node.init()) + ";"
               + (node.cond().isEmpty() ? "" : " ") + renderCommaSeparated(node.cond()) + ";"
               + (node.loop().isEmpty() ? "" : " ") + renderCommaSeparated(node.loop())
               + ") " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.Foreach node) {
        return "foreach (" + render(node.expr()) + " as "
               + node.keyVar().map(key -> render(key) + token(" => ")).orElse("")
               + (node.byRef() ? token("&") : "") + render(node.valueVar())
               + ") " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.While node) {
        return "while (" + render(node.cond()) + ") " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.Do node) {
        return "do " + body(node.stmts()) + " while (" + render(node.cond()) + ");";
    }

    @Override
    public String visit(Stmt.Switch node) {
        return "switch (" + render(node.cond()) + ") {" + renderBlock(node.cases(), true) + newline() + "}";
    }

    @Override
    public String visit(Stmt.Case node) {
        return node.cond().map(cond -> "case " + render(cond)).orElse("default")
               + ":" + renderBlock(node.stmts(), true);
    }

    @Override
    public String visit(Stmt.TryCatch node) {
        return "try " + body(node.stmts())
               + (node.catches().isEmpty() ? "" : " " + implode(node.catches(), " "))
               + node.finallyBlock().map(block -> " " + render(block)).orElse("");
    }

    @Override
    public String visit(Stmt.Catch node) {
        return "catch (" + implode(node.types(), "|")
               + node.var().map(var -> " " + render(var)).orElse("")
               + ") " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.Finally node) {
        return "finally " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.Throw node) {
        return "throw " + render(node.expr()) + ";";
    }

    @Override
    public String visit(Stmt.Break node) {
        return "break" + node.num().map(num -> " " + render(num)).orElse("") + ";";
    }

    @Override
    public String visit(Stmt.Continue node) {
        return "continue" + node.num().map(num -> " " + render(num)).orElse("") + ";";
    }

    @Override
    public String visit(Stmt.Goto node) {
        return "goto " + node.name().name() + ";";
    }

    @Override
    public String visit(Stmt.Label node) {
        return node.name().name() + ":";
    }

    @Override
    public String visit(Stmt.Static node) {
        return "static " + renderCommaSeparated(node.vars()) + ";";
    }

    @Override
    public String visit(Stmt.Global node) {
        return "global " + renderCommaSeparated(node.vars()) + ";";
    }

    @Override
    public String visit(Stmt.Unset node) {
        return "unset(" + renderCommaSeparated(node.vars()) + ");";
    }

    @Override
    public String visit(Stmt.Expression node) {
        return render(node.expr()) + ";";
    }

    @Override
    public String visit(Stmt.Nop node) {
        return "";
    }

    @Override
    public String visit(Stmt.InlineHtml node) {
        return "?>" + (node.hasLeadingNewline() ? "\n" : "") + node.value() + "<?php ";
    }

    @Override
    public String visit(Stmt.Namespace node) {
        if (semicolonNamespaces && node.name().isPresent()) {
            return "namespace " + render(node.name().get()) + ";" + newline() + renderBlock(node.stmts(), false);
        }
        return "namespace" + node.name().map(name -> " " + render(name)).orElse("") + " " + body(node.stmts());
    }

    protected boolean semicolonNamespaces() {
        return semicolonNamespaces;
    }

    @Override
    public String visit(Stmt.Use node) {
        return "use " + useType(node.type()) + renderCommaSeparated(node.uses()) + ";";
    }

    @Override
    public String visit(Stmt.GroupUse node) {
        return "use " + useType(node.type()) + render(node.prefix())
               + "\\{" + renderCommaSeparated(node.uses()) + "};";
    }

    @Override
    public String visit(Stmt.Const node) {
        return "const " + renderCommaSeparated(node.consts()) + ";";
    }

    @Override
    public String visit(Stmt.ClassConst node) {
        return modifiers(node.modifiers()) + "const " + renderCommaSeparated(node.consts()) + ";";
    }

    @Override
    public String visit(Stmt.Property node) {
        return (node.modifiers().isEmpty() ? "var " : modifiers(node.modifiers()))
               + node.type().map(type -> render(type) + " ").orElse("")
               + renderCommaSeparated(node.props()) + ";";
    }

    @Override
    public String visit(Stmt.FunctionDecl node) {
        return "function " + (node.byRef() ? token("&") : "") + node.name().name()
               + "(" + renderCommaSeparated(node.params()) + ")"
               + returnType(node.returnType())
               + newline() + body(node.stmts());
    }

    @Override
    public String visit(Stmt.ClassMethod node) {
        return modifiers(node.modifiers())
               + "function " + (node.byRef() ? token("&") : "") + node.name().name()
               + "(" + renderCommaSeparated(node.params()) + ")"
               + returnType(node.returnType())
               + node.stmts().map(stmts -> newline() + body(stmts)).orElse(";");
    }

    @Override
    public String visit(Stmt.ClassDecl node) {
        return classCommon(node, node.name().map(name -> " " + name.name()).orElse(""));
    }

    @Override
    public String visit(Stmt.InterfaceDecl node) {
        return "interface " + node.name().name()
               + (node.extendsList().isEmpty() ? "" : " extends " + renderCommaSeparated(node.extendsList()))
               + newline() + body(node.stmts());
    }

    @Override
    public String visit(Stmt.TraitDecl node) {
        return "trait " + node.name().name() + newline() + body(node.stmts());
    }

    @Override
    public String visit(Stmt.TraitUse node) {
        return "use " + renderCommaSeparated(node.traits())
               + (node.adaptations().isEmpty() ? ";" : " " + body(node.adaptations()));
    }

    @Override
    public String visit(Stmt.TraitAlias node) {
        return node.trait().map(trait -> render(trait) + "::").orElse("")
               + node.method().name() + " as"
               + node.newModifier().map(modifier -> " " + modifier.keyword()).orElse("")
               + node.newName().map(name -> " " + name.name()).orElse("")
               + ";";
    }

    @Override
    public String visit(Stmt.TraitPrecedence node) {
        return render(node.trait()) + "::" + node.method().name()
               + " insteadof " + renderCommaSeparated(node.insteadof()) + ";";
    }
}
