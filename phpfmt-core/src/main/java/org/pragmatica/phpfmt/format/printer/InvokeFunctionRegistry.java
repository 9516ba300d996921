package org.pragmatica.phpfmt.format.printer;

import java.util.Map;
import java.util.Optional;

/**
 * Drupal functions and methods that take a hook, theme or alter name as an argument.
 * Lookups match the call-site name exactly.
 */
public final class InvokeFunctionRegistry {

    /**
     * @param role     kind of name the call takes: {@code hook}, {@code fieldhook}, {@code entityhook},
     *                 {@code userhook}, {@code theme} or {@code alter}
     * @param position zero-based position of the name-bearing argument
     */
    public record InvokeFunction(String role, int position) {}

    private static final InvokeFunctionRegistry DRUPAL = new InvokeFunctionRegistry(Map.ofEntries(
            Map.entry("_field_invoke", new InvokeFunction("fieldhook", 1)),
            Map.entry("_field_invoke_default", new InvokeFunction("fieldhook", 1)),
            Map.entry("_field_invoke_multiple", new InvokeFunction("fieldhook", 1)),
            Map.entry("_field_invoke_multiple_default", new InvokeFunction("fieldhook", 1)),
            Map.entry("bootstrap_invoke_all", new InvokeFunction("hook", 1)),
            Map.entry("getImplementations", new InvokeFunction("hook", 1)),
            Map.entry("implementsHook", new InvokeFunction("hook", 2)),
            Map.entry("invoke", new InvokeFunction("hook", 2)),
            Map.entry("invokeAll", new InvokeFunction("hook", 1)),
            Map.entry("invokeHook", new InvokeFunction("entityhook", 1)),
            Map.entry("module_hook", new InvokeFunction("hook", 2)),
            Map.entry("module_implements", new InvokeFunction("hook", 1)),
            Map.entry("module_invoke", new InvokeFunction("hook", 2)),
            Map.entry("module_invoke_all", new InvokeFunction("hook", 1)),
            Map.entry("node_invoke", new InvokeFunction("hook", 1)),
            Map.entry("user_module_invoke", new InvokeFunction("userhook", 1)),
            Map.entry("theme", new InvokeFunction("theme", 1)),
            Map.entry("drupal_alter", new InvokeFunction("alter", 1)),
            Map.entry("alter", new InvokeFunction("alter", 1)),
            Map.entry("alterInfo", new InvokeFunction("alter", 1))));

    private final Map<String, InvokeFunction> functions;

    private InvokeFunctionRegistry(Map<String, InvokeFunction> functions) {
        this.functions = Map.copyOf(functions);
    }

    public static InvokeFunctionRegistry drupalRegistry() {
        return DRUPAL;
    }

    public static InvokeFunctionRegistry registry(Map<String, InvokeFunction> functions) {
        return new InvokeFunctionRegistry(functions);
    }

    public Optional<InvokeFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Map<String, InvokeFunction> functions() {
        return functions;
    }
}
