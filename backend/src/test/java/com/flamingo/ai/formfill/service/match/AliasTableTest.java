package com.flamingo.ai.formfill.service.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.formfill.exception.UnknownAttributeException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AliasTableTest {

  @Test
  void shouldExposeBuiltInAliasesForEveryAttribute() {
    AliasTable table = AliasTable.defaults();

    assertThat(table.asMap()).hasSize(AttributeKey.values().length);
    assertThat(table.aliasesFor(AttributeKey.EMAIL)).contains("email", "email address");
    assertThat(table.domainTokensFor(AttributeKey.EDUCATION_DEGREE)).contains("bachelor", "bs");
    assertThat(table.domainTokensFor(AttributeKey.EMAIL)).isEmpty();
  }

  @Test
  void shouldAppendExtraAliasesWithoutReplacingDefaults() {
    AliasTable table =
        AliasTable.defaults().withAdditional(Map.of("phone", List.of("whatsapp", " ", "tel")));

    assertThat(table.aliasesFor(AttributeKey.PHONE))
        .startsWith("phone", "phone number")
        .endsWith("whatsapp")
        .containsOnlyOnce("tel")
        .doesNotContain(" ");
  }

  @Test
  void shouldLeaveOriginalTableUntouched() {
    AliasTable defaults = AliasTable.defaults();

    defaults.withAdditional(Map.of("skills", List.of("tech stack")));

    assertThat(defaults.aliasesFor(AttributeKey.SKILLS)).doesNotContain("tech stack");
  }

  @Test
  void shouldRejectUnknownAttributeKey() {
    assertThatThrownBy(
            () -> AliasTable.defaults().withAdditional(Map.of("shoeSize", List.of("shoe size"))))
        .isInstanceOf(UnknownAttributeException.class)
        .hasMessageContaining("shoeSize");
  }

  @Test
  void shouldAddDomainTokens() {
    AliasTable table =
        AliasTable.defaults().withDomainTokens(Map.of("education.degree", List.of("licence")));

    assertThat(table.domainTokensFor(AttributeKey.EDUCATION_DEGREE)).endsWith("licence");
  }
}
