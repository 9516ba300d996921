package org.pragmatica.phpfmt.format.printer;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InvokeFunctionRegistryTest {
    private final InvokeFunctionRegistry registry = InvokeFunctionRegistry.drupalRegistry();

    @Test
    void drupalRegistry_knowsHookThemeAndAlterFunctions() {
        assertThat(registry.functions()).hasSize(20);
        assertThat(registry.lookup("theme"))
                  .contains(new InvokeFunctionRegistry.InvokeFunction("theme", 1));
        assertThat(registry.lookup("module_invoke"))
                  .contains(new InvokeFunctionRegistry.InvokeFunction("hook", 2));
        assertThat(registry.lookup("drupal_alter").map(InvokeFunctionRegistry.InvokeFunction::role))
                  .contains("alter");
        assertThat(registry.lookup("user_module_invoke").map(InvokeFunctionRegistry.InvokeFunction::role))
                  .contains("userhook");
    }

    @Test
    void lookup_matchesNameExactly() {
        assertThat(registry.lookup("Theme")).isEmpty();
        assertThat(registry.lookup("theme_get_registry")).isEmpty();
    }

    @Test
    void registry_acceptsCustomEntries() {
        var custom = InvokeFunctionRegistry.registry(Map.of("render_hook", new InvokeFunctionRegistry.InvokeFunction("hook", 1)));

        assertThat(custom.lookup("render_hook")).isPresent();
        assertThat(custom.lookup("theme")).isEmpty();
    }
}
