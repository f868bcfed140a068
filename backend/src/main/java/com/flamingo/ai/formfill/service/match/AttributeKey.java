package com.flamingo.ai.formfill.service.match;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The closed set of profile attributes the matcher can bind, in declaration order. Declaration
 * order is the second tie-break when two candidates score the same.
 */
public enum AttributeKey {
  FULL_NAME(
      "fullName",
      SemanticType.NAME,
      "name",
      "full name",
      "your name",
      "legal name",
      "applicant name",
      "candidate name"),
  FIRST_NAME(
      "firstName", SemanticType.NAME, "first name", "given name", "fname", "forename"),
  LAST_NAME("lastName", SemanticType.NAME, "last name", "surname", "family name", "lname"),
  EMAIL("email", SemanticType.EMAIL, "email", "email address", "mail", "contact email"),
  PHONE(
      "phone",
      SemanticType.PHONE,
      "phone",
      "phone number",
      "telephone",
      "tel",
      "mobile",
      "mobile number",
      "cell",
      "contact number"),
  ADDRESS(
      "address",
      SemanticType.LONG_TEXT,
      "address",
      "street address",
      "home address",
      "mailing address",
      "location"),
  EDUCATION_INSTITUTION(
      "education.institution",
      SemanticType.TEXT,
      "school",
      "university",
      "college",
      "institution",
      "school name",
      "university name",
      "alma mater"),
  EDUCATION_DEGREE(
      "education.degree",
      SemanticType.DEGREE,
      "degree",
      "highest degree",
      "education level",
      "qualification",
      "degree type",
      "level of education"),
  EDUCATION_FIELD(
      "education.field",
      SemanticType.TEXT,
      "major",
      "field of study",
      "discipline",
      "specialization",
      "area of study"),
  EDUCATION_START_DATE(
      "education.startDate",
      SemanticType.DATE,
      "school start date",
      "education start date",
      "enrollment date",
      "date enrolled"),
  EDUCATION_END_DATE(
      "education.endDate",
      SemanticType.DATE,
      "graduation date",
      "graduation year",
      "education end date",
      "date graduated",
      "year of graduation"),
  EDUCATION(
      "education",
      SemanticType.HISTORY,
      "education",
      "education history",
      "academic background",
      "educational background"),
  EXPERIENCE_EMPLOYER(
      "experience.employer",
      SemanticType.TEXT,
      "employer",
      "company",
      "company name",
      "current employer",
      "current company",
      "organization",
      "most recent employer"),
  EXPERIENCE_TITLE(
      "experience.title",
      SemanticType.TEXT,
      "job title",
      "title",
      "position",
      "current title",
      "role",
      "current position",
      "designation"),
  EXPERIENCE_START_DATE(
      "experience.startDate",
      SemanticType.DATE,
      "start date",
      "employment start date",
      "date started"),
  EXPERIENCE_END_DATE(
      "experience.endDate", SemanticType.DATE, "end date", "employment end date", "date ended"),
  EXPERIENCE_DESCRIPTION(
      "experience.description",
      SemanticType.LONG_TEXT,
      "job description",
      "responsibilities",
      "role description",
      "duties"),
  EXPERIENCE(
      "experience",
      SemanticType.HISTORY,
      "experience",
      "work experience",
      "work history",
      "employment history",
      "professional experience"),
  SKILLS(
      "skills",
      SemanticType.LIST,
      "skills",
      "key skills",
      "technical skills",
      "competencies",
      "expertise");

  private final String key;
  private final SemanticType semanticType;
  private final List<String> defaultAliases;

  AttributeKey(String key, SemanticType semanticType, String... defaultAliases) {
    this.key = key;
    this.semanticType = semanticType;
    this.defaultAliases = List.of(defaultAliases);
  }

  /** External key, as used in configuration and attribute paths. */
  public String key() {
    return key;
  }

  public SemanticType semanticType() {
    return semanticType;
  }

  public List<String> defaultAliases() {
    return defaultAliases;
  }

  /** The key this one is split from, or null for keys read directly from the profile. */
  public AttributeKey source() {
    return this == FIRST_NAME || this == LAST_NAME ? FULL_NAME : null;
  }

  /**
   * Whether binding this key would put a fact already bound through {@code used} into a second
   * field. A split key conflicts with its source, and a source conflicts with any of its parts.
   *
   * @param used keys already assigned to a field
   * @return true if this key must not be assigned
   */
  public boolean conflictsWith(Set<AttributeKey> used) {
    if (source() != null) {
      return used.contains(source());
    }
    return used.stream().anyMatch(other -> other.source() == this);
  }

  /**
   * Looks up a key by its external name.
   *
   * @param key external key such as {@code education.degree}
   * @return the attribute key, or empty when unknown
   */
  public static Optional<AttributeKey> fromKey(String key) {
    return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
  }
}
