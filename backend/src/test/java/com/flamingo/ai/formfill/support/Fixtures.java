package com.flamingo.ai.formfill.support;

import com.flamingo.ai.formfill.domain.profile.Education;
import com.flamingo.ai.formfill.domain.profile.Profile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.core.io.ClassPathResource;

/** Shared test data. */
public final class Fixtures {

  private Fixtures() {}

  /** Reads a test resource as UTF-8 text. */
  public static String resource(String location) {
    try {
      return new ClassPathResource(location).getContentAsString(StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Missing test resource " + location, e);
    }
  }

  /** A complete applicant profile matching the fields of {@code forms/application-form.html}. */
  public static Profile applicant() {
    return Profile.builder()
        .fullName("Jane Doe")
        .email("jane@x.com")
        .phone("555-1234")
        .address("1 Main St, Springfield")
        .education(
            List.of(
                Education.builder()
                    .institution("MIT")
                    .degree("Bachelor of Science")
                    .field("Physics")
                    .endDate("2019-05")
                    .build()))
        .skills(new LinkedHashSet<>(List.of("Java", "Go", "SQL")))
        .build();
  }
}
