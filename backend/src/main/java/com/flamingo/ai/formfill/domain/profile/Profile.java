package com.flamingo.ai.formfill.domain.profile;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/**
 * Candidate data produced by the resume extraction collaborator.
 *
 * <p>Education and experience keep their source order; skills keep insertion order.
 */
@Builder
public record Profile(
    String fullName,
    String email,
    String phone,
    String address,
    List<Education> education,
    List<Experience> experience,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> skills) {

  public Profile {
    education = education == null ? List.of() : List.copyOf(education);
    experience = experience == null ? List.of() : List.copyOf(experience);
    skills =
        skills == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(skills));
  }

  /** Returns the first (most recent by convention) education entry, or null. */
  public Education latestEducation() {
    return education.isEmpty() ? null : education.get(0);
  }

  /** Returns the first (most recent by convention) experience entry, or null. */
  public Experience latestExperience() {
    return experience.isEmpty() ? null : experience.get(0);
  }
}
