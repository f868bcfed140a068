package com.flamingo.ai.formfill.domain.profile;

import lombok.Builder;

/**
 * One education entry of a profile. Dates are kept as the free text found in the resume (for
 * example {@code 2019}, {@code 2019-09} or {@code Sep 2019}) and parsed only when a form needs
 * them.
 */
@Builder
public record Education(
    String institution, String degree, String field, String startDate, String endDate) {}
