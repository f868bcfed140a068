package com.flamingo.ai.formfill.api.dto.response;

import com.flamingo.ai.formfill.service.execute.FillOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the outcome of one field. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldOutcomeResponse {

  private String fieldId;
  private String label;
  private String sourceAttributePath;
  private String status;
  private String expected;
  private String observed;
  private String cause;
  private int attempts;

  /** Creates a FieldOutcomeResponse from an outcome. */
  public static FieldOutcomeResponse from(FillOutcome outcome) {
    return FieldOutcomeResponse.builder()
        .fieldId(outcome.fieldDescriptorId())
        .label(outcome.fieldLabel())
        .sourceAttributePath(outcome.sourceAttributePath())
        .status(outcome.status().name())
        .expected(outcome.expected())
        .observed(outcome.observed())
        .cause(outcome.cause())
        .attempts(outcome.attempts())
        .build();
  }
}
