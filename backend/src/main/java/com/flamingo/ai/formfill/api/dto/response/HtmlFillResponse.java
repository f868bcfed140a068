package com.flamingo.ai.formfill.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a static HTML fill: the plan on a dry run, else the report and markup. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HtmlFillResponse {

  private FillPlanResponse plan;
  private RunReportResponse report;
  private String html;
}
