package org.pragmatica.phpfmt.format.printer;

/**
 * HTML span markup for annotated output.
 */
public final class Markup {
    public static final String KEYWORD = "php-keyword";
    public static final String CONSTANT = "php-constant";
    public static final String FUNCTION_OR_CONSTANT = "php-function-or-constant";
    public static final String DECLARED = "php-function-or-constant-declared";
    public static final String VARIABLE = "php-variable";
    public static final String STRING = "php-string";
    public static final String COMMENT = "php-comment";
    public static final String BOUNDARY = "php-boundary";

    public static final String CLOSE = "</span>";

    private Markup() {}

    public static String open(String cssClass) {
        return "<span class=\"" + cssClass + "\">";
    }

    public static String span(String cssClass, String content) {
        return open(cssClass) + content + CLOSE;
    }

    public static String keyword(String keyword) {
        return span(KEYWORD, keyword);
    }

    /**
     * Escapes text for inclusion in HTML element content or a quoted attribute.
     */
    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                   .replace("<", "&lt;")
                   .replace(">", "&gt;")
                   .replace("\"", "&quot;")
                   .replace("'", "&#039;");
    }

    public static String stripTags(String markup) {
        return markup.replaceAll("<[^>]*>", "");
    }

    /**
     * Removes tags and reverts {@link #escape(String)}.
     */
    public static String plainText(String markup) {
        return stripTags(markup).replace("&lt;", "<")
                                .replace("&gt;", ">")
                                .replace("&quot;", "\"")
                                .replace("&#039;", "'")
                                .replace("&amp;", "&");
    }
}
