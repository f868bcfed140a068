package com.flamingo.ai.formfill.domain.profile;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.formfill.exception.InvalidProfileException;
import com.flamingo.ai.formfill.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ProfileValidatorTest {

  private final ProfileValidator validator = new ProfileValidator();

  @Test
  void shouldAcceptCompleteProfile() {
    assertThatCode(() -> validator.validate(Fixtures.applicant())).doesNotThrowAnyException();
  }

  @Test
  void shouldAcceptProfileWithOnlyIdentityFields() {
    Profile minimal = Profile.builder().fullName("Jane Doe").email("jane.o'neil@x.co").build();

    assertThatCode(() -> validator.validate(minimal)).doesNotThrowAnyException();
  }

  @Test
  void shouldRejectMissingProfile() {
    assertThatThrownBy(() -> validator.validate(null))
        .isInstanceOf(InvalidProfileException.class)
        .extracting("attribute")
        .isEqualTo("profile");
  }

  @Test
  void shouldRejectBlankFullName() {
    Profile profile = Profile.builder().fullName("  ").email("jane@x.com").build();

    assertThatThrownBy(() -> validator.validate(profile))
        .isInstanceOf(InvalidProfileException.class)
        .hasMessageContaining("Full name is required")
        .extracting("attribute")
        .isEqualTo("fullName");
  }

  @Test
  void shouldRejectMissingEmail() {
    Profile profile = Profile.builder().fullName("Jane Doe").build();

    assertThatThrownBy(() -> validator.validate(profile))
        .isInstanceOf(InvalidProfileException.class)
        .extracting("attribute")
        .isEqualTo("email");
  }

  @ParameterizedTest
  @ValueSource(strings = {"jane", "jane@", "jane@x", "@x.com", "jane doe@x.com"})
  void shouldRejectMalformedEmail(String email) {
    Profile profile = Profile.builder().fullName("Jane Doe").email(email).build();

    assertThatThrownBy(() -> validator.validate(profile))
        .isInstanceOf(InvalidProfileException.class)
        .hasMessageContaining("not a valid address");
  }
}
