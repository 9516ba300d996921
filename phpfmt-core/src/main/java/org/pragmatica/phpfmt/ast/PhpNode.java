package org.pragmatica.phpfmt.ast;

import java.util.List;

/**
 * Node of a parsed PHP syntax tree.
 *
 * Nodes are immutable records. A tree is changed by building new records, which keeps
 * unchanged subtrees equal to their originals (the format-preserving reprint relies on that).
 */
public sealed interface PhpNode permits Stmt, Expr, Name, Identifier, NullableType, Param, Arg, ArrayItem,
                                        InterpolatedStringPart, ClosureUse, ConstDecl, StaticVar, UseItem,
                                        PropertyItem {

    Attributes attributes();

    <R> R accept(NodeVisitor<R> visitor);

    default NodeKind kind() {
        return NodeKind.of(this);
    }

    default List<Comment> comments() {
        return attributes().comments();
    }
}
