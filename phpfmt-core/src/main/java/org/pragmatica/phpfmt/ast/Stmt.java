package org.pragmatica.phpfmt.ast;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Statements, including declarations.
 */
public sealed interface Stmt extends PhpNode {

    record Echo(List<Expr> exprs, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Return(Optional<Expr> expr, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record If(Expr cond, List<Stmt> stmts, List<ElseIf> elseifs, Optional<Else> otherwise, Attributes attributes)
            implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ElseIf(Expr cond, List<Stmt> stmts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Else(List<Stmt> stmts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record For(List<Expr> init, List<Expr> cond, List<Expr> loop, List<Stmt> stmts, Attributes attributes)
            implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Foreach(Expr expr,
                   Optional<Expr> keyVar,
                   Expr valueVar,
                   boolean byRef,
                   List<Stmt> stmts,
                   Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record While(Expr cond, List<Stmt> stmts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Do(Expr cond, List<Stmt> stmts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Switch(Expr cond, List<Case> cases, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Switch case; an empty condition is the {@code default} case.
     */
    record Case(Optional<Expr> cond, List<Stmt> stmts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TryCatch(List<Stmt> stmts, List<Catch> catches, Optional<Finally> finallyBlock, Attributes attributes)
            implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Catch(List<Name> types, Optional<Expr.Variable> var, List<Stmt> stmts, Attributes attributes)
            implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Finally(List<Stmt> stmts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Throw(Expr expr, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Break(Optional<Expr> num, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Continue(Optional<Expr> num, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Goto(Identifier name, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Label(Identifier name, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Static(List<StaticVar> vars, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Global(List<Expr> vars, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Unset(List<Expr> vars, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Expression used as a statement; printed with a terminating semicolon.
     */
    record Expression(Expr expr, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Empty statement; carries comments that are not attached to any real statement.
     */
    record Nop(Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Text outside of the {@code <?php ... ?>} tags.
     */
    record InlineHtml(String value, boolean hasLeadingNewline, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Namespace(Optional<Name> name, List<Stmt> stmts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Use(UseType type, List<UseItem> uses, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record GroupUse(UseType type, Name prefix, List<UseItem> uses, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Const(List<ConstDecl> consts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ClassConst(Set<Modifier> modifiers, List<ConstDecl> consts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Property(Set<Modifier> modifiers, Optional<PhpNode> type, List<PropertyItem> props, Attributes attributes)
            implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record FunctionDecl(boolean byRef,
                        Identifier name,
                        List<Param> params,
                        Optional<PhpNode> returnType,
                        List<Stmt> stmts,
                        Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Class method; abstract and interface methods have no body.
     */
    record ClassMethod(Set<Modifier> modifiers,
                       boolean byRef,
                       Identifier name,
                       List<Param> params,
                       Optional<PhpNode> returnType,
                       Optional<List<Stmt>> stmts,
                       Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Class declaration; anonymous classes (used by {@code new class}) have no name.
     */
    record ClassDecl(Set<Modifier> modifiers,
                     Optional<Identifier> name,
                     Optional<Name> extendsClass,
                     List<Name> implementsList,
                     List<Stmt> stmts,
                     Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record InterfaceDecl(Identifier name, List<Name> extendsList, List<Stmt> stmts, Attributes attributes)
            implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TraitDecl(Identifier name, List<Stmt> stmts, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TraitUse(List<Name> traits, List<Stmt> adaptations, Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * {@code Trait::method as [modifier] [newName];}
     */
    record TraitAlias(Optional<Name> trait,
                      Identifier method,
                      Optional<Modifier> newModifier,
                      Optional<Identifier> newName,
                      Attributes attributes) implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * {@code Trait::method insteadof Other;}
     */
    record TraitPrecedence(Name trait, Identifier method, List<Name> insteadof, Attributes attributes)
            implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
