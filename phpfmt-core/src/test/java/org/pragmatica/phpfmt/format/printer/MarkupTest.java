package org.pragmatica.phpfmt.format.printer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarkupTest {

    @Test
    void escape_encodesHtmlSpecialCharacters() {
        assertThat(Markup.escape("<a href=\"x\">Tom & Jerry's</a>"))
                  .isEqualTo("&lt;a href=&quot;x&quot;&gt;Tom &amp; Jerry&#039;s&lt;/a&gt;");
    }

    @Test
    void span_wrapsContentInClassedSpan() {
        assertThat(Markup.keyword("function"))
                  .isEqualTo("<span class=\"php-keyword\">function</span>");
    }

    @Test
    void plainText_revertsMarkupAndEscaping() {
        var markup = Markup.span(Markup.STRING, Markup.escape("'a & <b>'"));

        assertThat(Markup.plainText(markup)).isEqualTo("'a & <b>'");
    }

    @Test
    void plainText_keepsEscapedEntityLiterals() {
        assertThat(Markup.plainText(Markup.escape("&lt;"))).isEqualTo("&lt;");
    }
}
