package org.pragmatica.phpfmt.format.printer;

import org.pragmatica.phpfmt.ast.Arg;
import org.pragmatica.phpfmt.ast.ArrayItem;
import org.pragmatica.phpfmt.ast.ArrayKind;
import org.pragmatica.phpfmt.ast.Comment;
import org.pragmatica.phpfmt.ast.ConstDecl;
import org.pragmatica.phpfmt.ast.Expr;
import org.pragmatica.phpfmt.ast.Identifier;
import org.pragmatica.phpfmt.ast.Name;
import org.pragmatica.phpfmt.ast.PhpNode;
import org.pragmatica.phpfmt.ast.Stmt;
import org.pragmatica.phpfmt.ast.StringKind;
import org.pragmatica.phpfmt.ast.UseItem;
import org.pragmatica.phpfmt.ast.UseType;
import org.pragmatica.phpfmt.format.PrinterConfig;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.pragmatica.phpfmt.format.printer.Markup.BOUNDARY;
import static org.pragmatica.phpfmt.format.printer.Markup.COMMENT;
import static org.pragmatica.phpfmt.format.printer.Markup.CONSTANT;
import static org.pragmatica.phpfmt.format.printer.Markup.DECLARED;
import static org.pragmatica.phpfmt.format.printer.Markup.FUNCTION_OR_CONSTANT;
import static org.pragmatica.phpfmt.format.printer.Markup.VARIABLE;

/**
 * Drupal coding-standard renderer with optional HTML annotation.
 *
 * Differences from {@link StandardPrinter}:
 * - two-space indentation
 * - { on the header line for functions, methods, closures, classes, interfaces and traits
 * - blank line before the closing } of class, interface and trait bodies
 * - comments grouped into blocks, blank line before multi-line comments
 * - non-empty arrays one entry per line with trailing commas, entry comments kept
 * - chained method calls one per line
 * - function and method headers over 80 characters split one parameter per line
 *
 * When annotating, keywords, names, variables, literals and comments are wrapped in spans, and string
 * literals that look like hook, theme or element names get a marker class derived from their context.
 */
public class DrupalNodeRenderer extends StandardPrinter {
    private static final Pattern LEADING_KEYWORD = Pattern.compile("^( *)([a-z]+)");
    private static final int MAX_HEADER_WIDTH = 80;

    private final PrinterConfig config;
    private final RenderState state;
    private final ContextualClassifier classifier;

    public DrupalNodeRenderer(PrinterConfig config, InvokeFunctionRegistry registry) {
        super(IndentationTracker.indentationTracker(IndentationTracker.DRUPAL_UNIT), config.shortArraySyntax());
        this.config = config;
        this.state = new RenderState(config.annotate());
        this.classifier = new ContextualClassifier(registry, config.drupalMode());
    }

    public static DrupalNodeRenderer drupalNodeRenderer(PrinterConfig config) {
        return new DrupalNodeRenderer(config, InvokeFunctionRegistry.drupalRegistry());
    }

    public PrinterConfig config() {
        return config;
    }

    public RenderState state() {
        return state;
    }

    @Override
    protected Scope beginPass() {
        return state.beginPass();
    }

    // ===== Annotation helpers =====

    /**
     * Annotation applies: configured, and not inside the text of an interpolated string,
     * which is escaped as a whole.
     */
    private boolean annotating() {
        return config.annotate() && !state.inLiteralText();
    }

    private String keyword(String keyword) {
        return annotating()
               ? Markup.keyword(keyword)
               : keyword;
    }

    private String spanned(String cssClass, String content) {
        return annotating()
               ? Markup.span(cssClass, content)
               : content;
    }

    private String withLeadingKeyword(String text) {
        if (!annotating()) {
            return text;
        }
        return LEADING_KEYWORD.matcher(text)
                              .replaceFirst("$1" + Matcher.quoteReplacement(Markup.open(Markup.KEYWORD)) + "$2"
                                            + Matcher.quoteReplacement(Markup.CLOSE));
    }

    @Override
    protected String token(String text) {
        return annotating()
               ? Markup.escape(text)
               : text;
    }

    @Override
    protected String useType(UseType type) {
        var keyword = type.keyword();
        return keyword.isEmpty()
               ? ""
               : keyword(keyword) + " ";
    }

    private static String memberOf(String receiverMarkup) {
        return "$this".equals(Markup.stripTags(receiverMarkup))
               ? "member-of-self"
               : "member-of-variable";
    }

    private static String memberOfClass(String className) {
        if ("static".equals(className) || "self".equals(className)) {
            return "member-of-self";
        }
        if ("parent".equals(className)) {
            return "member-of-parent";
        }
        return "member-of-class-" + className;
    }

    // ===== Blocks and comments =====

    @Override
    protected String renderComments(List<Comment> comments) {
        var formatted = comments.stream()
                                .map(this::formatComment)
                                .toList();
        if (!annotating()) {
            return String.join(newline(), formatted);
        }
        var open = Markup.open(COMMENT);
        return open + String.join(Markup.CLOSE + newline() + open, formatted) + Markup.CLOSE;
    }

    private String formatComment(Comment comment) {
        var reformatted = comment.reformattedText();
        var text = reformatted.replace("\n", newline());

        if (reformatted.startsWith("/**\n * @file")) {
            text = text + "\n";
        }
        if (annotating()) {
            text = Markup.escape(text);
        }
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            text = newline() + text;
        }
        return text;
    }

    /**
     * Nodes one per line, one level deeper, each followed by a comma; ends with a line break at the
     * outer indentation.
     */
    protected String renderCommaSeparatedMultiLine(List<? extends PhpNode> nodes) {
        String result;
        try (var indented = indentation.indented()) {
            result = indentation.unitSpaces() + implode(nodes, "," + newline()) + (nodes.isEmpty() ? "" : ",");
        }
        return result + newline();
    }

    /**
     * Class-like body: blank line before the closing brace.
     */
    private String classBody(List<? extends Stmt> stmts) {
        return "{" + renderBlock(stmts, true) + "\n" + newline() + "}";
    }

    // ===== Scalars and literals =====

    @Override
    public String visit(Expr.StringLiteral node) {
        if (state.inLiteralText()) {
            return super.visit(node);
        }

        state.clearLastLiteral();
        var value = node.value();

        if (node.quoting() == StringKind.HEREDOC || node.quoting() == StringKind.NOWDOC) {
            return annotating()
                   ? Markup.escape(super.visit(node))
                   : super.visit(node);
        }

        String text;
        if (!annotating()) {
            text = super.visit(node);
        } else if (node.quoting() == StringKind.SINGLE_QUOTED) {
            text = Markup.span(classifier.stringClass(state, value),
                               "'" + Markup.escape(escapeSingleQuoted(value)) + "'");
        } else {
            text = Markup.span(classifier.stringClass(state, value),
                               "\"" + Markup.escape(escapeString(value, '"')) + "\"");
        }

        state.literalRendered(value);
        return text;
    }

    @Override
    public String visit(Expr.InterpolatedString node) {
        if (!annotating()) {
            return super.visit(node);
        }

        state.clearLastLiteral();
        String content;
        String text;
        try (var literal = state.enterLiteralText()) {
            if (node.quoting() == StringKind.HEREDOC) {
                content = encapsList(node.parts(), null);
                text = Markup.escape(super.visit(node));
            } else {
                content = encapsList(node.parts(), '"');
                text = "\"" + Markup.escape(content) + "\"";
            }
        }

        var span = Markup.span(classifier.stringClass(state, content), text);
        state.literalRendered(content);
        return span;
    }

    @Override
    public String visit(Expr.IntLiteral node) {
        return spanned(CONSTANT, super.visit(node));
    }

    @Override
    public String visit(Expr.FloatLiteral node) {
        return spanned(CONSTANT, super.visit(node));
    }

    @Override
    public String visit(Expr.MagicConst node) {
        return spanned(CONSTANT, super.visit(node));
    }

    @Override
    public String visit(Expr.ConstFetch node) {
        return spanned(FUNCTION_OR_CONSTANT, super.visit(node));
    }

    @Override
    public String visit(Expr.Variable node) {
        return spanned(VARIABLE, super.visit(node));
    }

    @Override
    public String visit(Expr.Cast node) {
        if (!annotating()) {
            return super.visit(node);
        }
        return prefix(Precedence.UNARY, "(" + Markup.keyword(node.type().keyword()) + ") ", node.expr());
    }

    // ===== Calls =====

    @Override
    public String visit(Expr.FuncCall node) {
        var name = callLhs(node.name());
        var site = node.name() instanceof Name
                   ? CallSite.named(name)
                   : CallSite.dynamic(Markup.plainText(name));

        String args;
        try (var call = state.enterCall(site)) {
            args = renderCommaSeparated(node.args());
        }
        return spanned(FUNCTION_OR_CONSTANT, name) + "(" + args + ")";
    }

    @Override
    public String visit(Expr.MethodCall node) {
        var receiver = dereferenceLhs(node.var());
        var method = objectProperty(node.name());
        var site = node.name() instanceof Identifier identifier
                   ? CallSite.named(identifier.name())
                   : CallSite.dynamic(Markup.plainText(method));

        String args;
        try (var call = state.enterCall(site)) {
            args = renderCommaSeparated(node.args());
        }

        var operator = node.nullsafe() ? "?->" : "->";
        if (state.inLiteralText()) {
            return receiver + operator + method + "(" + args + ")";
        }

        // The first call of a chain stays on the receiver's line
        var chained = receiver.contains(token("->"));
        var spacing = chained
                      ? newline() + indentation.unitSpaces()
                      : "";

        if (!annotating()) {
            return receiver + spacing + operator + method + "(" + args + ")";
        }
        var cssClass = FUNCTION_OR_CONSTANT + " function " + memberOf(receiver);
        return receiver + spacing + token(operator) + Markup.span(cssClass, method) + "(" + args + ")";
    }

    @Override
    public String visit(Expr.StaticCall node) {
        var classText = dereferenceLhs(node.classRef());
        var method = staticMemberName(node.name());
        var site = node.name() instanceof Identifier identifier
                   ? CallSite.named(identifier.name())
                   : CallSite.dynamic(Markup.plainText(method));

        String args;
        try (var call = state.enterCall(site)) {
            args = renderCommaSeparated(node.args());
        }

        if (!annotating()) {
            return classText + "::" + method + "(" + args + ")";
        }
        var className = Markup.stripTags(classText);
        var cssClass = FUNCTION_OR_CONSTANT + " function " + memberOfClass(className);
        return Markup.span(FUNCTION_OR_CONSTANT, className) + "::" + Markup.span(cssClass, method)
               + "(" + args + ")";
    }

    @Override
    public String visit(Arg node) {
        var text = super.visit(node);
        state.argumentRendered();
        return text;
    }

    @Override
    public String visit(Expr.PropertyFetch node) {
        if (!annotating()) {
            return super.visit(node);
        }
        var receiver = dereferenceLhs(node.var());
        var cssClass = FUNCTION_OR_CONSTANT + " property " + memberOf(receiver);
        return receiver + token(node.nullsafe() ? "?->" : "->")
               + Markup.span(cssClass, objectProperty(node.name()));
    }

    @Override
    public String visit(Expr.StaticPropertyFetch node) {
        if (!annotating()) {
            return super.visit(node);
        }
        var className = Markup.stripTags(dereferenceLhs(node.classRef()));
        var cssClass = FUNCTION_OR_CONSTANT + " property " + memberOfClass(className);
        return Markup.span(FUNCTION_OR_CONSTANT, className) + "::$"
               + Markup.span(cssClass, objectProperty(node.name()));
    }

    @Override
    public String visit(Expr.New node) {
        var args = renderCommaSeparated(node.args());
        if (node.classRef() instanceof Stmt.ClassDecl anonymous) {
            return keyword("new") + " " + classCommon(anonymous, node.args().isEmpty() ? "" : "(" + args + ")");
        }
        return keyword("new") + " " + spanned(FUNCTION_OR_CONSTANT, newVariable(node.classRef())) + "(" + args + ")";
    }

    // ===== Arrays =====

    @Override
    public String visit(Expr.ArrayLiteral node) {
        var items = node.items().isEmpty()
                    ? ""
                    : newline() + renderCommaSeparatedMultiLine(node.items());

        if (arraySyntax(node) == ArrayKind.SHORT) {
            return "[" + items + "]";
        }
        return keyword("array") + "(" + items + ")";
    }

    @Override
    public String visit(ArrayItem node) {
        var sb = new StringBuilder();
        if (!node.comments().isEmpty()) {
            sb.append(renderComments(node.comments())).append(newline());
        }

        state.clearLastLiteral();
        Optional<String> key;
        try (var keyScope = state.enterArrayKey()) {
            key = node.key().map(this::render);
        }
        var literalKey = key.isPresent()
                         ? state.lastLiteral()
                         : Optional.<String>empty();

        try (var value = state.enterArrayValue(literalKey)) {
            key.ifPresent(text -> sb.append(text).append(token(" => ")));
            sb.append(node.byRef() ? token("&") : "")
              .append(node.unpack() ? "..." : "")
              .append(render(node.value()));
        }
        return sb.toString();
    }

    // ===== Keyword-led constructs =====

    @Override
    public String visit(Expr.Isset node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Expr.ListExpr node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Expr.Clone node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Expr.Include node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Expr.Exit node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Expr.Empty node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Expr.Eval node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.For node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Foreach node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.While node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Do node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Switch node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Case node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.TryCatch node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Catch node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Throw node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Finally node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Break node) {
        return withLeadingKeyword(super.visit(node)) + "\n";
    }

    @Override
    public String visit(Stmt.Continue node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Return node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Goto node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Echo node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Static node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Global node) {
        return withLeadingKeyword(super.visit(node));
    }

    @Override
    public String visit(Stmt.Unset node) {
        return withLeadingKeyword(super.visit(node));
    }

    // ===== Conditionals =====

    @Override
    public String visit(Stmt.If node) {
        return keyword("if") + " (" + render(node.cond()) + ") " + body(node.stmts())
               + implode(node.elseifs(), "")
               + node.otherwise().map(this::render).orElse("");
    }

    @Override
    public String visit(Stmt.ElseIf node) {
        return newline() + keyword("elseif") + " (" + render(node.cond()) + ") " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.Else node) {
        return newline() + keyword("else") + " " + body(node.stmts());
    }

    // ===== Declarations =====

    @Override
    public String visit(Stmt.FunctionDecl node) {
        var head = keyword("function") + " " + (node.byRef() ? token("&") : "");
        var returnType = returnType(node.returnType());
        var header = head + spanned(DECLARED, node.name().name())
                     + "(" + renderCommaSeparated(node.params()) + ")" + returnType;

        if (!config.annotate() && header.length() > MAX_HEADER_WIDTH) {
            header = head + node.name().name()
                     + "(" + newline() + renderCommaSeparatedMultiLine(node.params()) + ")" + returnType;
        }
        return header + " " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.ClassMethod node) {
        var head = modifiers(node.modifiers()) + keyword("function") + " " + (node.byRef() ? token("&") : "");
        var returnType = returnType(node.returnType());
        var header = head + spanned(FUNCTION_OR_CONSTANT, node.name().name())
                     + "(" + renderCommaSeparated(node.params()) + ")" + returnType;

        if (!config.annotate() && header.length() > MAX_HEADER_WIDTH) {
            header = head + node.name().name()
                     + "(" + newline() + renderCommaSeparatedMultiLine(node.params()) + ")" + returnType;
        }
        return header + node.stmts().map(stmts -> " " + body(stmts)).orElse(";");
    }

    @Override
    public String visit(Expr.Closure node) {
        return (node.isStatic() ? keyword("static") + " " : "")
               + keyword("function") + " " + (node.byRef() ? token("&") : "")
               + "(" + renderCommaSeparated(node.params()) + ")"
               + (node.uses().isEmpty() ? "" : " " + keyword("use") + " (" + renderCommaSeparated(node.uses()) + ")")
               + returnType(node.returnType())
               + " " + body(node.stmts());
    }

    @Override
    protected String classCommon(Stmt.ClassDecl node, String afterClassToken) {
        var name = node.name()
                       .map(identifier -> " " + spanned(FUNCTION_OR_CONSTANT, identifier.name()))
                       .orElse(afterClassToken);
        return modifiers(node.modifiers())
               + keyword("class") + name
               + node.extendsClass().map(parent -> " " + keyword("extends") + " " + render(parent)).orElse("")
               + (node.implementsList().isEmpty()
                  ? ""
                  : " " + keyword("implements") + " " + renderCommaSeparated(node.implementsList()))
               + " " + classBody(node.stmts());
    }

    @Override
    public String visit(Stmt.InterfaceDecl node) {
        return keyword("interface") + " " + spanned(FUNCTION_OR_CONSTANT, node.name().name())
               + (node.extendsList().isEmpty()
                  ? ""
                  : " " + keyword("extends") + " " + renderCommaSeparated(node.extendsList()))
               + " " + classBody(node.stmts());
    }

    @Override
    public String visit(Stmt.TraitDecl node) {
        return keyword("trait") + " " + spanned(FUNCTION_OR_CONSTANT, node.name().name())
               + " " + classBody(node.stmts());
    }

    @Override
    public String visit(Stmt.Const node) {
        return keyword("const") + " " + renderCommaSeparated(node.consts()) + ";";
    }

    @Override
    public String visit(Stmt.ClassConst node) {
        return modifiers(node.modifiers()) + keyword("const") + " " + renderCommaSeparated(node.consts()) + ";";
    }

    @Override
    public String visit(ConstDecl node) {
        return spanned(DECLARED, node.name().name()) + " = " + render(node.value());
    }

    // ===== File structure =====

    @Override
    public String visit(Stmt.InlineHtml node) {
        if (!annotating()) {
            return super.visit(node);
        }
        return Markup.span(BOUNDARY, Markup.escape("?>"))
               + Markup.escape((node.hasLeadingNewline() ? "\n" : "") + node.value())
               + Markup.span(BOUNDARY, Markup.escape("<?php")) + "\n";
    }

    @Override
    public String visit(Stmt.Namespace node) {
        if (!annotating()) {
            return super.visit(node);
        }
        var name = node.name().map(value -> Markup.span(FUNCTION_OR_CONSTANT, render(value)));
        if (semicolonNamespaces() && name.isPresent()) {
            return keyword("namespace") + " " + name.get() + ";" + newline() + renderBlock(node.stmts(), false);
        }
        return keyword("namespace") + name.map(value -> " " + value).orElse("") + " " + body(node.stmts());
    }

    @Override
    public String visit(Stmt.Use node) {
        return keyword("use") + " " + useType(node.type()) + renderCommaSeparated(node.uses()) + ";";
    }

    @Override
    public String visit(Stmt.GroupUse node) {
        return keyword("use") + " " + useType(node.type()) + spanned(FUNCTION_OR_CONSTANT, render(node.prefix()))
               + "\\{" + renderCommaSeparated(node.uses()) + "};";
    }

    @Override
    public String visit(UseItem node) {
        if (!annotating()) {
            return super.visit(node);
        }
        var alias = node.alias()
                        .map(Identifier::name)
                        .filter(value -> !value.equals(node.name().last()))
                        .map(value -> " " + Markup.keyword("as") + " " + Markup.span(FUNCTION_OR_CONSTANT, value))
                        .orElse("");
        return useType(node.type()) + Markup.span(FUNCTION_OR_CONSTANT, render(node.name())) + alias;
    }

    @Override
    public String visit(Stmt.TraitUse node) {
        return keyword("use") + " " + renderCommaSeparated(node.traits())
               + (node.adaptations().isEmpty() ? ";" : " " + body(node.adaptations()));
    }

    @Override
    public String visit(Stmt.TraitPrecedence node) {
        if (!annotating()) {
            return super.visit(node);
        }
        var trait = render(node.trait());
        return Markup.span(FUNCTION_OR_CONSTANT, trait) + "::"
               + Markup.span(FUNCTION_OR_CONSTANT + " function member-of-class-" + trait, node.method().name())
               + " " + Markup.keyword("insteadof") + " " + renderCommaSeparated(node.insteadof()) + ";";
    }

    @Override
    public String visit(Stmt.TraitAlias node) {
        if (!annotating()) {
            return super.visit(node);
        }
        var trait = node.trait().map(this::render);
        var cssClass = trait.map(value -> FUNCTION_OR_CONSTANT + " function member-of-class-" + value)
                            .orElse(FUNCTION_OR_CONSTANT + " function");
        return trait.map(value -> Markup.span(FUNCTION_OR_CONSTANT, value) + "::").orElse("")
               + Markup.span(cssClass, node.method().name()) + " "
               + Markup.keyword("as")
               + node.newModifier().map(modifier -> " " + modifier.keyword()).orElse("")
               + node.newName().map(name -> " " + Markup.span(FUNCTION_OR_CONSTANT, name.name())).orElse("")
               + ";";
    }
}
