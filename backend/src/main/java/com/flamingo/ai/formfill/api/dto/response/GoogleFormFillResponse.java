package com.flamingo.ai.formfill.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a Google Form fill. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GoogleFormFillResponse {

  private String formUrl;
  private FillPlanResponse plan;
  private RunReportResponse report;
  private boolean submitted;
}
