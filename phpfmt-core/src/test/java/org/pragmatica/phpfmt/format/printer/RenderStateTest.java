package org.pragmatica.phpfmt.format.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.phpfmt.format.StateInvariantException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderStateTest {
    private final RenderState state = new RenderState(true);

    @Test
    void enterCall_pushesAndScopePops() {
        try (var outer = state.enterCall(CallSite.named("module_invoke"))) {
            try (var inner = state.enterCall(CallSite.named("t"))) {
                assertThat(state.callDepth()).isEqualTo(2);
                assertThat(state.innermostCall()).contains(CallSite.named("t"));
                assertThat(state.firstArgument()).isTrue();
            }
            assertThat(state.innermostCall()).contains(CallSite.named("module_invoke"));
        }

        assertThat(state.callDepth()).isZero();
        assertThat(state.innermostCall()).isEmpty();
    }

    @Test
    void popCall_failsOnEmptyStack() {
        assertThatThrownBy(state::popCall)
                  .isInstanceOf(StateInvariantException.class);
    }

    @Test
    void argumentRendered_clearsFirstArgument() {
        try (var call = state.enterCall(CallSite.named("theme"))) {
            state.argumentRendered();
            assertThat(state.firstArgument()).isFalse();
        }
    }

    @Test
    void enterCall_keepsArrayContextOfEnclosingEntry() {
        try (var value = state.enterArrayValue(Optional.of("#theme"))) {
            try (var call = state.enterCall(CallSite.named("t"))) {
                assertThat(state.inArrayValue()).isTrue();
                assertThat(state.arrayKey()).contains("#theme");
            }
            assertThat(state.callDepth()).isZero();
        }

        assertThat(state.inArrayValue()).isFalse();
    }

    @Test
    void enterArrayValue_restoresOuterKey() {
        try (var outer = state.enterArrayValue(Optional.of("#type"))) {
            try (var inner = state.enterArrayValue(Optional.empty())) {
                assertThat(state.arrayKey()).isEmpty();
            }
            assertThat(state.arrayKey()).contains("#type");
        }
    }

    @Test
    void enterArrayKey_leavesValueContextUntilScopeCloses() {
        try (var value = state.enterArrayValue(Optional.of("#theme"))) {
            try (var key = state.enterArrayKey()) {
                assertThat(state.inArrayKey()).isTrue();
                assertThat(state.inArrayValue()).isFalse();
            }
            assertThat(state.inArrayKey()).isFalse();
            assertThat(state.arrayKey()).contains("#theme");
        }
    }

    @Test
    void enterLiteralText_restoresPreviousFlag() {
        try (var outer = state.enterLiteralText()) {
            try (var inner = state.enterLiteralText()) {
                assertThat(state.inLiteralText()).isTrue();
            }
            assertThat(state.inLiteralText()).isTrue();
        }

        assertThat(state.inLiteralText()).isFalse();
    }

    @Test
    void beginPass_resetsStateAndRejectsNestedPass() {
        state.enterCall(CallSite.named("leaked"));
        state.literalRendered("value");

        try (var pass = state.beginPass()) {
            assertThat(state.callDepth()).isZero();
            assertThat(state.lastLiteral()).isEmpty();
            assertThatThrownBy(state::beginPass)
                      .isInstanceOf(StateInvariantException.class);
        }

        try (var again = state.beginPass()) {
            assertThat(state.annotating()).isTrue();
        }
    }
}
