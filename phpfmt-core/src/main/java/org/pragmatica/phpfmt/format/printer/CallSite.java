package org.pragmatica.phpfmt.format.printer;

/**
 * Call whose argument list is being rendered. Dynamic call sites ({@code $fn()}, {@code $obj->$method()})
 * carry their rendered target text and are never matched against the registry.
 */
public record CallSite(String name, boolean dynamic) {

    public static CallSite named(String name) {
        return new CallSite(name, false);
    }

    public static CallSite dynamic(String text) {
        return new CallSite(text, true);
    }
}
