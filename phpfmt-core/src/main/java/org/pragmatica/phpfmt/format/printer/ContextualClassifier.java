package org.pragmatica.phpfmt.format.printer;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a string literal is probably a Drupal theme hook, render element or hook name,
 * judging only by where it appears: the key of the array entry it is the value of, or the call
 * whose arguments it is in.
 */
public final class ContextualClassifier {
    // Everything from 0x7f up counts, as multibyte names do byte-wise in PHP
    private static final Pattern IDENTIFIER_LIKE = Pattern.compile("^[a-zA-Z0-9_\\x7f-\\x{10FFFF}]+$");
    private static final String MARKER_PREFIX = "possible-";

    private final InvokeFunctionRegistry registry;
    private final boolean drupalMode;

    public ContextualClassifier(InvokeFunctionRegistry registry, boolean drupalMode) {
        this.registry = registry;
        this.drupalMode = drupalMode;
    }

    /**
     * Marker class for {@code value}, such as {@code possible-theme}, or empty when the literal is unremarkable.
     */
    public Optional<String> classify(RenderState state, String value) {
        // "0" is falsy in PHP and was never taken for a hook name
        if (!state.annotating() || !drupalMode || state.inArrayKey() || "0".equals(value)
            || !IDENTIFIER_LIKE.matcher(value).matches()) {
            return Optional.empty();
        }

        if (state.inArrayValue() && state.arrayKey().isPresent()) {
            return switch (state.arrayKey().get()) {
                case "#theme" -> Optional.of(MARKER_PREFIX + "theme");
                case "#type" -> Optional.of(MARKER_PREFIX + "element");
                default -> Optional.empty();
            };
        }

        return state.innermostCall()
                    .filter(site -> !site.dynamic())
                    .flatMap(site -> registry.lookup(site.name()))
                    .map(function -> MARKER_PREFIX + function.role());
    }

    /**
     * Full class attribute value for a string literal span.
     */
    public String stringClass(RenderState state, String value) {
        return classify(state, value).map(marker -> Markup.STRING + " " + marker)
                                     .orElse(Markup.STRING);
    }
}
