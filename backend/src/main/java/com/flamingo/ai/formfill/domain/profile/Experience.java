package com.flamingo.ai.formfill.domain.profile;

import lombok.Builder;

/** One work experience entry of a profile. Dates are free text, as in {@link Education}. */
@Builder
public record Experience(
    String employer, String title, String startDate, String endDate, String description) {}
