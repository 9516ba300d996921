package org.pragmatica.phpfmt.ast;

import java.util.List;
import java.util.Optional;

/**
 * Parser-supplied metadata attached to a node: leading comments and the token span
 * the node was parsed from.
 */
public record Attributes(List<Comment> comments, Optional<SourceSpan> span) {

    public static final Attributes EMPTY = new Attributes(List.of(), Optional.empty());

    public Attributes {
        comments = List.copyOf(comments);
    }

    public static Attributes commented(Comment... comments) {
        return new Attributes(List.of(comments), Optional.empty());
    }

    public static Attributes spanning(int startToken, int endToken) {
        return new Attributes(List.of(), Optional.of(new SourceSpan(startToken, endToken)));
    }

    public Attributes withComments(List<Comment> comments) {
        return new Attributes(comments, span);
    }

    public Attributes withSpan(SourceSpan span) {
        return new Attributes(comments, Optional.of(span));
    }
}
