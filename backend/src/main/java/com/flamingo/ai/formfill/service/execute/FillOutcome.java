package com.flamingo.ai.formfill.service.execute;

import com.flamingo.ai.formfill.service.match.FillPlanEntry;

/**
 * Final result for one field.
 *
 * @param fieldDescriptorId the field
 * @param fieldLabel the field's label, for display
 * @param sourceAttributePath the profile path that was applied, null when unmatched
 * @param status the outcome
 * @param expected the value that was meant to be shown, null when nothing was applied
 * @param observed what the page showed after the last attempt, null unless verification failed
 * @param cause failure description, null unless execution failed
 * @param attempts how many times the value was applied
 */
public record FillOutcome(
    String fieldDescriptorId,
    String fieldLabel,
    String sourceAttributePath,
    Status status,
    String expected,
    String observed,
    String cause,
    int attempts) {

  public enum Status {
    FILLED,
    SKIPPED_UNMATCHED,
    VERIFICATION_FAILED,
    EXECUTION_FAILED,
    NOT_ATTEMPTED
  }

  static FillOutcome filled(FillPlanEntry entry, int attempts) {
    return of(entry, Status.FILLED, null, null, attempts);
  }

  static FillOutcome skippedUnmatched(FillPlanEntry entry) {
    return of(entry, Status.SKIPPED_UNMATCHED, null, null, 0);
  }

  static FillOutcome verificationFailed(FillPlanEntry entry, String observed, int attempts) {
    return of(entry, Status.VERIFICATION_FAILED, observed, null, attempts);
  }

  static FillOutcome executionFailed(FillPlanEntry entry, String cause, int attempts) {
    return of(entry, Status.EXECUTION_FAILED, null, cause, attempts);
  }

  static FillOutcome notAttempted(FillPlanEntry entry) {
    return of(entry, Status.NOT_ATTEMPTED, null, null, 0);
  }

  private static FillOutcome of(
      FillPlanEntry entry, Status status, String observed, String cause, int attempts) {
    return new FillOutcome(
        entry.fieldDescriptorId(),
        entry.field().label(),
        entry.sourceAttributePath(),
        status,
        entry.coercedValue() == null ? null : entry.coercedValue().display(),
        observed,
        cause,
        attempts);
  }

  public boolean isFailure() {
    return status == Status.VERIFICATION_FAILED || status == Status.EXECUTION_FAILED;
  }
}
