package com.flamingo.ai.formfill.api.dto.response;

import com.flamingo.ai.formfill.service.match.FillPlan;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a fill plan preview. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillPlanResponse {

  private List<PlanEntryResponse> entries;
  private List<String> unmatchedFields;
  private List<String> unassignedAttributes;

  /** Creates a FillPlanResponse from a fill plan. */
  public static FillPlanResponse from(FillPlan plan) {
    return FillPlanResponse.builder()
        .entries(plan.entries().stream().map(PlanEntryResponse::from).toList())
        .unmatchedFields(plan.unmatchedFieldIds())
        .unassignedAttributes(plan.unassignedAttributePaths())
        .build();
  }
}
