package org.pragmatica.phpfmt.format.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.phpfmt.format.StateInvariantException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.phpfmt.format.printer.IndentationTracker.indentationTracker;

class IndentationTrackerTest {

    @Test
    void indent_extendsNewlineByOneUnit() {
        var tracker = indentationTracker(IndentationTracker.DRUPAL_UNIT);

        tracker.indent();
        tracker.indent();

        assertThat(tracker.depth()).isEqualTo(2);
        assertThat(tracker.newline()).isEqualTo("\n    ");
        assertThat(tracker.unitSpaces()).isEqualTo("  ");
    }

    @Test
    void indented_restoresDepthWhenScopeCloses() {
        var tracker = indentationTracker(IndentationTracker.STANDARD_UNIT);

        try (var scope = tracker.indented()) {
            assertThat(tracker.newline()).isEqualTo("\n    ");
        }

        assertThat(tracker.depth()).isZero();
        assertThat(tracker.newline()).isEqualTo("\n");
    }

    @Test
    void outdent_failsAtZeroDepth() {
        var tracker = indentationTracker(IndentationTracker.DRUPAL_UNIT);

        assertThatThrownBy(tracker::outdent)
                  .isInstanceOf(StateInvariantException.class);
    }

    @Test
    void indentationTracker_rejectsNonPositiveUnit() {
        assertThatThrownBy(() -> indentationTracker(0))
                  .isInstanceOf(IllegalArgumentException.class);
    }
}
