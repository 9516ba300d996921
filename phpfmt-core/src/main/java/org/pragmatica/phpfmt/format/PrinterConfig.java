package org.pragmatica.phpfmt.format;

import java.util.Locale;
import java.util.Map;

/**
 * Configuration for the Drupal printer.
 *
 * @param annotate         wrap keywords, names, literals and comments in HTML spans
 * @param shortArraySyntax render arrays without explicit syntax as {@code []} rather than {@code array()}
 * @param drupalMode       classify string literals as hook, theme and element names
 */
public record PrinterConfig(boolean annotate, boolean shortArraySyntax, boolean drupalMode) {

    public static final PrinterConfig DEFAULT = new PrinterConfig(false, true, true);

    /**
     * Factory method for default config.
     */
    public static PrinterConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Config from string options as used by the API documentation generator:
     * {@code html}, {@code isDrupal} and {@code shortArraySyntax}, each {@code true} or {@code false}.
     * Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException on an unknown key or a value that is not a boolean
     */
    public static PrinterConfig fromOptions(Map<String, String> options) {
        var config = DEFAULT;

        for (var entry : options.entrySet()) {
            var value = parseBoolean(entry.getKey(), entry.getValue());
            config = switch (entry.getKey()) {
                case "html" -> config.withAnnotate(value);
                case "isDrupal" -> config.withDrupalMode(value);
                case "shortArraySyntax" -> config.withShortArraySyntax(value);
                default -> throw new IllegalArgumentException("Unknown printer option: " + entry.getKey());
            };
        }
        return config;
    }

    private static boolean parseBoolean(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing value for printer option: " + key);
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for printer option " + key + ": " + value);
        };
    }

    /**
     * Builder-style method to toggle HTML annotation.
     */
    public PrinterConfig withAnnotate(boolean annotate) {
        return new PrinterConfig(annotate, shortArraySyntax, drupalMode);
    }

    public PrinterConfig withShortArraySyntax(boolean shortArraySyntax) {
        return new PrinterConfig(annotate, shortArraySyntax, drupalMode);
    }

    public PrinterConfig withDrupalMode(boolean drupalMode) {
        return new PrinterConfig(annotate, shortArraySyntax, drupalMode);
    }
}
