package org.pragmatica.phpfmt.format;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrinterConfigTest {

    @Test
    void defaultConfig_printsPlainDrupalCodeWithShortArrays() {
        var config = PrinterConfig.defaultConfig();

        assertThat(config.annotate()).isFalse();
        assertThat(config.shortArraySyntax()).isTrue();
        assertThat(config.drupalMode()).isTrue();
    }

    @Test
    void withMethods_changeOneSettingEach() {
        var config = PrinterConfig.defaultConfig()
                                  .withAnnotate(true)
                                  .withShortArraySyntax(false);

        assertThat(config).isEqualTo(new PrinterConfig(true, false, true));
        assertThat(PrinterConfig.defaultConfig()).isEqualTo(PrinterConfig.DEFAULT);
    }

    @Test
    void fromOptions_readsOriginalOptionNames() {
        var config = PrinterConfig.fromOptions(Map.of("html", "true", "isDrupal", "0", "shortArraySyntax", "FALSE"));

        assertThat(config).isEqualTo(new PrinterConfig(true, false, false));
        assertThat(PrinterConfig.fromOptions(Map.of())).isEqualTo(PrinterConfig.DEFAULT);
    }

    @Test
    void fromOptions_rejectsUnknownKey() {
        assertThatThrownBy(() -> PrinterConfig.fromOptions(Map.of("indent", "2")))
                  .isInstanceOf(IllegalArgumentException.class)
                  .hasMessageContaining("indent");
    }

    @Test
    void fromOptions_rejectsInvalidValues() {
        var missing = new HashMap<String, String>();
        missing.put("html", null);

        assertThatThrownBy(() -> PrinterConfig.fromOptions(Map.of("html", "yes")))
                  .isInstanceOf(IllegalArgumentException.class)
                  .hasMessageContaining("yes");
        assertThatThrownBy(() -> PrinterConfig.fromOptions(missing))
                  .isInstanceOf(IllegalArgumentException.class);
    }
}
