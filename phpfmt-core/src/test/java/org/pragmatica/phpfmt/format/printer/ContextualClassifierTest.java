package org.pragmatica.phpfmt.format.printer;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ContextualClassifierTest {
    private final InvokeFunctionRegistry registry = InvokeFunctionRegistry.drupalRegistry();
    private final ContextualClassifier classifier = new ContextualClassifier(registry, true);
    private final RenderState state = new RenderState(true);

    @Test
    void classify_marksArgumentOfRegisteredCall() {
        try (var call = state.enterCall(CallSite.named("theme"))) {
            assertThat(classifier.classify(state, "user_picture")).contains("possible-theme");
        }
        try (var call = state.enterCall(CallSite.named("module_invoke_all"))) {
            assertThat(classifier.classify(state, "node_view")).contains("possible-hook");
        }
    }

    @Test
    void classify_usesInnermostCall() {
        try (var outer = state.enterCall(CallSite.named("theme"));
             var inner = state.enterCall(CallSite.named("t"))) {
            assertThat(classifier.classify(state, "Title")).isEmpty();
        }
    }

    @Test
    void classify_ignoresDynamicCallSites() {
        try (var call = state.enterCall(CallSite.dynamic("theme"))) {
            assertThat(classifier.classify(state, "user_picture")).isEmpty();
        }
    }

    @Test
    void classify_marksRenderArrayKeys() {
        try (var value = state.enterArrayValue(Optional.of("#theme"))) {
            assertThat(classifier.classify(state, "comment")).contains("possible-theme");
        }
        try (var value = state.enterArrayValue(Optional.of("#type"))) {
            assertThat(classifier.classify(state, "textfield")).contains("possible-element");
        }
    }

    @Test
    void classify_neverMarksArrayKeys() {
        try (var call = state.enterCall(CallSite.named("theme"));
             var key = state.enterArrayKey()) {
            assertThat(classifier.classify(state, "variables")).isEmpty();
        }
    }

    @Test
    void classify_otherArrayKeySuppressesCallContext() {
        try (var call = state.enterCall(CallSite.named("theme"));
             var value = state.enterArrayValue(Optional.of("#title"))) {
            assertThat(classifier.classify(state, "user_picture")).isEmpty();
        }
    }

    @Test
    void classify_requiresIdentifierLikeValue() {
        try (var call = state.enterCall(CallSite.named("theme"))) {
            assertThat(classifier.classify(state, "user picture")).isEmpty();
            assertThat(classifier.classify(state, "")).isEmpty();
            assertThat(classifier.classify(state, "0")).isEmpty();
            assertThat(classifier.classify(state, "café_block")).contains("possible-theme");
        }
    }

    @Test
    void classify_requiresAnnotationAndDrupalMode() {
        var plainState = new RenderState(false);
        var genericClassifier = new ContextualClassifier(registry, false);

        try (var call = plainState.enterCall(CallSite.named("theme"))) {
            assertThat(classifier.classify(plainState, "user_picture")).isEmpty();
        }
        try (var call = state.enterCall(CallSite.named("theme"))) {
            assertThat(genericClassifier.classify(state, "user_picture")).isEmpty();
        }
    }

    @Test
    void stringClass_appendsMarkerToBaseClass() {
        assertThat(classifier.stringClass(state, "user_picture")).isEqualTo("php-string");

        try (var call = state.enterCall(CallSite.named("drupal_alter"))) {
            assertThat(classifier.stringClass(state, "form")).isEqualTo("php-string possible-alter");
        }
    }
}
