package org.pragmatica.phpfmt.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NameTest {

    @Test
    void name_parsesQualification() {
        var unqualified = Name.name("Drupal\\Core\\Url");
        var qualified = Name.name("\\Drupal");
        var relative = Name.name("namespace\\Helper");

        assertThat(unqualified.parts()).containsExactly("Drupal", "Core", "Url");
        assertThat(unqualified.qualification()).isEqualTo(Name.Qualification.UNQUALIFIED);
        assertThat(qualified.qualification()).isEqualTo(Name.Qualification.FULLY_QUALIFIED);
        assertThat(relative.qualification()).isEqualTo(Name.Qualification.RELATIVE);
        assertThat(relative.parts()).containsExactly("Helper");
    }

    @Test
    void asString_restoresSourceForm() {
        assertThat(Name.name("\\Drupal\\Core\\Url").asString()).isEqualTo("\\Drupal\\Core\\Url");
        assertThat(Name.name("namespace\\Helper").asString()).isEqualTo("namespace\\Helper");
        assertThat(Name.name("Drupal\\Core\\Url").last()).isEqualTo("Url");
    }

    @Test
    void name_rejectsEmptyParts() {
        assertThatThrownBy(() -> new Name(List.of(), Name.Qualification.UNQUALIFIED, Attributes.EMPTY))
                  .isInstanceOf(IllegalArgumentException.class);
    }
}
