package com.flamingo.ai.formfill.service.match;

import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.exception.IncoercibleValueException;

/**
 * What the executor should do with one field.
 *
 * @param field the target field
 * @param status whether a value was assigned
 * @param sourceAttributePath profile path of the assigned value, null when unmatched
 * @param coercedValue value to apply, null unless assigned
 * @param score candidate score, 0 when unmatched
 * @param strategyName strategy that produced the score, null when unmatched
 * @param coercionFailure why the assigned value could not be coerced, null otherwise
 */
public record FillPlanEntry(
    FieldDescriptor field,
    Status status,
    String sourceAttributePath,
    CoercedValue coercedValue,
    double score,
    String strategyName,
    IncoercibleValueException coercionFailure) {

  public enum Status {
    ASSIGNED,
    UNMATCHED,
    INCOERCIBLE
  }

  static FillPlanEntry assigned(MatchCandidate candidate, CoercedValue value) {
    return new FillPlanEntry(
        candidate.field(),
        Status.ASSIGNED,
        candidate.profileAttributePath(),
        value,
        candidate.score(),
        candidate.strategyName(),
        null);
  }

  static FillPlanEntry incoercible(MatchCandidate candidate, IncoercibleValueException failure) {
    return new FillPlanEntry(
        candidate.field(),
        Status.INCOERCIBLE,
        candidate.profileAttributePath(),
        null,
        candidate.score(),
        candidate.strategyName(),
        failure);
  }

  static FillPlanEntry unmatched(FieldDescriptor field) {
    return new FillPlanEntry(field, Status.UNMATCHED, null, null, 0.0, null, null);
  }

  public String fieldDescriptorId() {
    return field.id();
  }

  public boolean isUnmatched() {
    return status == Status.UNMATCHED;
  }
}
