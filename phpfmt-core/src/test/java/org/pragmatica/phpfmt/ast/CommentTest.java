package org.pragmatica.phpfmt.ast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommentTest {

    @Test
    void reformattedText_trimsSingleLineComment() {
        assertThat(new Comment("   // Load the node.  ").reformattedText())
                  .isEqualTo("// Load the node.");
    }

    @Test
    void reformattedText_realignsStarPrefixedBlock() {
        var comment = new Comment("""
                /**
                         * Implements hook_menu().
                         *
                         * @return array
                         */""");

        assertThat(comment.reformattedText())
                  .isEqualTo("/**\n * Implements hook_menu().\n *\n * @return array\n */");
    }

    @Test
    void reformattedText_removesClosingIndentFromBlockWithOpenerOnOwnLine() {
        var comment = new Comment("/*\n        First line.\n          Nested.\n        */");

        assertThat(comment.reformattedText())
                  .isEqualTo("/*\nFirst line.\n  Nested.\n*/");
    }

    @Test
    void reformattedText_removesCommonIndentAfterOpenerWithText() {
        var comment = new Comment("/* First line.\n       second line. */");

        assertThat(comment.reformattedText())
                  .isEqualTo("/* First line.\n   second line. */");
    }

    @Test
    void isDocComment_distinguishesDocBlocks() {
        assertThat(new Comment("/** Doc. */").isDocComment()).isTrue();
        assertThat(new Comment("/* Block. */").isDocComment()).isFalse();
        assertThat(new Comment("// Line.").isDocComment()).isFalse();
    }
}
