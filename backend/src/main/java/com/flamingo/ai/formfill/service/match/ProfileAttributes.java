package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.domain.profile.Education;
import com.flamingo.ai.formfill.domain.profile.Experience;
import com.flamingo.ai.formfill.domain.profile.Profile;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Flattens a profile into bindable attribute values in declaration order. Blank values are left
 * out. List sections bind their first (most recent) entry to per-entry attributes and the whole
 * history to the {@code education} and {@code experience} attributes. First and last name are
 * split from the full name and carry the paths {@code fullName.first} and {@code fullName.last}.
 */
public final class ProfileAttributes {

  private ProfileAttributes() {}

  /**
   * Flattens the profile.
   *
   * @param profile a validated profile
   * @return non-blank attribute values, in {@link AttributeKey} declaration order
   */
  public static List<AttributeValue> flatten(Profile profile) {
    List<AttributeValue> values = new ArrayList<>();
    String fullName = trim(profile.fullName());
    add(values, AttributeKey.FULL_NAME, "fullName", fullName);

    String[] nameParts = fullName == null ? new String[0] : fullName.split("\\s+", 2);
    if (nameParts.length == 2) {
      add(values, AttributeKey.FIRST_NAME, "fullName.first", nameParts[0]);
      add(values, AttributeKey.LAST_NAME, "fullName.last", nameParts[1]);
    }

    add(values, AttributeKey.EMAIL, "email", trim(profile.email()));
    add(values, AttributeKey.PHONE, "phone", trim(profile.phone()));
    add(values, AttributeKey.ADDRESS, "address", trim(profile.address()));

    Education education = profile.latestEducation();
    if (education != null) {
      String prefix = "education[0].";
      add(
          values,
          AttributeKey.EDUCATION_INSTITUTION,
          prefix + "institution",
          education.institution());
      add(values, AttributeKey.EDUCATION_DEGREE, prefix + "degree", education.degree());
      add(values, AttributeKey.EDUCATION_FIELD, prefix + "field", education.field());
      add(values, AttributeKey.EDUCATION_START_DATE, prefix + "startDate", education.startDate());
      add(values, AttributeKey.EDUCATION_END_DATE, prefix + "endDate", education.endDate());
    }
    add(
        values,
        AttributeKey.EDUCATION,
        "education",
        history(profile.education(), ProfileAttributes::describe));

    Experience experience = profile.latestExperience();
    if (experience != null) {
      String prefix = "experience[0].";
      add(values, AttributeKey.EXPERIENCE_EMPLOYER, prefix + "employer", experience.employer());
      add(values, AttributeKey.EXPERIENCE_TITLE, prefix + "title", experience.title());
      add(values, AttributeKey.EXPERIENCE_START_DATE, prefix + "startDate", experience.startDate());
      add(values, AttributeKey.EXPERIENCE_END_DATE, prefix + "endDate", experience.endDate());
      add(
          values,
          AttributeKey.EXPERIENCE_DESCRIPTION,
          prefix + "description",
          experience.description());
    }
    add(
        values,
        AttributeKey.EXPERIENCE,
        "experience",
        history(profile.experience(), ProfileAttributes::describe));

    List<String> skills =
        profile.skills().stream().map(ProfileAttributes::trim).filter(Objects::nonNull).toList();
    if (!skills.isEmpty()) {
      values.add(
          new AttributeValue(AttributeKey.SKILLS, "skills", String.join(", ", skills), skills));
    }
    return values;
  }

  static String describe(Education education) {
    String degree = joinNonBlank(" in ", education.degree(), education.field());
    return joinNonBlank(
        " ",
        joinNonBlank(", ", degree, education.institution()),
        period(education.startDate(), education.endDate()));
  }

  static String describe(Experience experience) {
    String headline =
        joinNonBlank(
            " ",
            joinNonBlank(", ", experience.title(), experience.employer()),
            period(experience.startDate(), experience.endDate()));
    return joinNonBlank("\n", headline, trim(experience.description()));
  }

  private static <T> String history(List<T> entries, Function<T, String> describer) {
    return entries.stream()
        .map(describer)
        .filter(Objects::nonNull)
        .collect(
            Collectors.collectingAndThen(
                Collectors.joining("\n\n"), joined -> joined.isEmpty() ? null : joined));
  }

  private static String period(String start, String end) {
    String range = joinNonBlank(" - ", start, end);
    return range == null ? null : "(" + range + ")";
  }

  private static String joinNonBlank(String separator, String... parts) {
    String joined =
        Stream.of(parts)
            .map(ProfileAttributes::trim)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(separator));
    return joined.isEmpty() ? null : joined;
  }

  private static void add(List<AttributeValue> values, AttributeKey key, String path, String text) {
    String trimmed = trim(text);
    if (trimmed != null) {
      values.add(AttributeValue.of(key, path, trimmed));
    }
  }

  private static String trim(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
