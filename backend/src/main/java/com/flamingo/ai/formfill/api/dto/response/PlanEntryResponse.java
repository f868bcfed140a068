package com.flamingo.ai.formfill.api.dto.response;

import com.flamingo.ai.formfill.service.match.FillPlanEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one fill plan entry. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanEntryResponse {

  private String fieldId;
  private String label;
  private String kind;
  private String status;
  private String sourceAttributePath;
  private String value;
  private double score;
  private String strategy;
  private String failure;

  /** Creates a PlanEntryResponse from a plan entry. */
  public static PlanEntryResponse from(FillPlanEntry entry) {
    return PlanEntryResponse.builder()
        .fieldId(entry.fieldDescriptorId())
        .label(entry.field().label())
        .kind(entry.field().kind().name())
        .status(entry.status().name())
        .sourceAttributePath(entry.sourceAttributePath())
        .value(entry.coercedValue() != null ? entry.coercedValue().display() : null)
        .score(entry.score())
        .strategy(entry.strategyName())
        .failure(
            entry.coercionFailure() != null
                ? entry.coercionFailure().getKind() + ": " + entry.coercionFailure().getMessage()
                : null)
        .build();
  }
}
