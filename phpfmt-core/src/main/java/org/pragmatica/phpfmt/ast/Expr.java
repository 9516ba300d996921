package org.pragmatica.phpfmt.ast;

import java.util.List;
import java.util.Optional;

/**
 * Expressions, including scalar literals.
 */
public sealed interface Expr extends PhpNode {

    /**
     * {@code $name}.
     */
    record Variable(String name, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Assign(Expr var, Expr expr, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record AssignRef(Expr var, Expr expr, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Compound assignment; {@code operator} is the binary operator without {@code =}, e.g. {@code "."}.
     */
    record AssignOp(String operator, Expr var, Expr expr, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record BinaryOp(String operator, Expr left, Expr right, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Prefix ({@code !}, {@code -}, {@code ~}, {@code @}, {@code ++}, ...) or postfix ({@code ++}, {@code --})
     * operator.
     */
    record UnaryOp(String operator, Expr expr, boolean postfix, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * {@code cond ? ifTrue : ifFalse}; without {@code ifTrue} this is the short {@code ?:} form.
     */
    record Ternary(Expr cond, Optional<Expr> ifTrue, Expr ifFalse, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Instanceof(Expr expr, PhpNode classRef, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Function call; {@code name} is a {@link Name} or, for dynamic calls, an expression.
     */
    record FuncCall(PhpNode name, List<Arg> args, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Method call; {@code name} is an {@link Identifier} or, for dynamic calls, an expression.
     */
    record MethodCall(Expr var, PhpNode name, List<Arg> args, boolean nullsafe, Attributes attributes)
            implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record StaticCall(PhpNode classRef, PhpNode name, List<Arg> args, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record PropertyFetch(Expr var, PhpNode name, boolean nullsafe, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record StaticPropertyFetch(PhpNode classRef, PhpNode name, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ClassConstFetch(PhpNode classRef, Identifier name, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Bare constant such as {@code TRUE}, {@code NULL} or {@code LANGUAGE_NONE}.
     */
    record ConstFetch(Name name, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ArrayDimFetch(Expr var, Optional<Expr> dim, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ArrayLiteral(List<ArrayItem> items, ArrayKind syntax, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Destructuring target: {@code list($a, $b)} or {@code [$a, $b]}.
     */
    record ListExpr(List<ArrayItem> items, boolean shortSyntax, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * {@code new}; {@code classRef} is a {@link Name}, an expression, or an anonymous {@link Stmt.ClassDecl}.
     */
    record New(PhpNode classRef, List<Arg> args, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Clone(Expr expr, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Isset(List<Expr> vars, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Empty(Expr expr, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Eval(Expr expr, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Include(Expr expr, IncludeType type, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * {@code exit} or {@code die}, with an optional status expression.
     */
    record Exit(Optional<Expr> expr, boolean die, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Print(Expr expr, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Closure(boolean isStatic,
                   boolean byRef,
                   List<Param> params,
                   List<ClosureUse> uses,
                   Optional<PhpNode> returnType,
                   List<Stmt> stmts,
                   Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ArrowFunction(boolean isStatic,
                         boolean byRef,
                         List<Param> params,
                         Optional<PhpNode> returnType,
                         Expr expr,
                         Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Cast(CastType type, Expr expr, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Placeholder an error-recovering parser leaves where an expression could not be parsed.
     */
    record Error(Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Single-quoted, double-quoted, heredoc or nowdoc string without interpolation.
     * {@code docLabel} is the heredoc/nowdoc label, empty for quoted strings.
     */
    record StringLiteral(String value, StringKind quoting, String docLabel, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Double-quoted or heredoc string with embedded expressions; parts are
     * {@link InterpolatedStringPart} or {@link Expr} nodes.
     */
    record InterpolatedString(List<PhpNode> parts, StringKind quoting, String docLabel, Attributes attributes)
            implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record IntLiteral(long value, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record FloatLiteral(double value, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record MagicConst(MagicConstKind constant, Attributes attributes) implements Expr {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
