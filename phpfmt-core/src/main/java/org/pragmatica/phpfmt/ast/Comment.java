package org.pragmatica.phpfmt.ast;

import java.util.regex.Pattern;

/**
 * Comment attached to a node, with its raw source text ("// ...", "/* ... *&#47;" or "/** ... *&#47;").
 */
public record Comment(String text) {

    private static final Pattern STAR_ALIGNED = Pattern.compile("^.*(?:\\R\\s+\\*.*)+$");
    private static final Pattern LINE_STAR = Pattern.compile("^\\s+\\*", Pattern.MULTILINE);
    private static final Pattern BLOCK_OPENER_ON_OWN_LINE = Pattern.compile("^/\\*\\*?\\s*[\\r\\n]");
    private static final Pattern CLOSER_INDENT = Pattern.compile("\\n(\\s*)\\*/$");
    private static final Pattern BLOCK_OPENER_WITH_TEXT = Pattern.compile("^/\\*\\*?\\s*(?!\\s)");

    public boolean isDocComment() {
        return text.startsWith("/**");
    }

    /**
     * Comment text trimmed, with continuation lines re-aligned so the comment no longer
     * depends on the indentation it had in the original source.
     */
    public String reformattedText() {
        var trimmed = text.strip();
        int newline = trimmed.indexOf('\n');

        if (newline < 0) {
            return trimmed;
        }

        if (STAR_ALIGNED.matcher(trimmed).matches()) {
            return LINE_STAR.matcher(trimmed).replaceAll(" *");
        }

        var closer = CLOSER_INDENT.matcher(trimmed);
        if (BLOCK_OPENER_ON_OWN_LINE.matcher(trimmed).find() && closer.find()) {
            var indent = closer.group(1);
            return Pattern.compile("^" + Pattern.quote(indent), Pattern.MULTILINE)
                          .matcher(trimmed)
                          .replaceAll("");
        }

        var opener = BLOCK_OPENER_WITH_TEXT.matcher(trimmed);
        if (opener.find()) {
            int prefixLength = shortestWhitespacePrefix(trimmed.substring(newline + 1));
            int removeLength = prefixLength - opener.group().length();
            if (removeLength > 0) {
                return Pattern.compile("^\\s{" + removeLength + "}", Pattern.MULTILINE)
                              .matcher(trimmed)
                              .replaceAll("");
            }
        }

        return trimmed;
    }

    private static int shortestWhitespacePrefix(String lines) {
        int shortest = Integer.MAX_VALUE;
        for (var line : lines.split("\n", -1)) {
            int length = line.length() - line.stripLeading().length();
            shortest = Math.min(shortest, length);
        }
        return shortest;
    }
}
