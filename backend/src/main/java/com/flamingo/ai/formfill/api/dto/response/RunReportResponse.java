package com.flamingo.ai.formfill.api.dto.response;

import com.flamingo.ai.formfill.service.execute.RunReport;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a run report. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunReportResponse {

  private String pageId;
  private int total;
  private long filled;
  private long unmatched;
  private long failed;
  private long notAttempted;
  private boolean cancelled;
  private List<FieldOutcomeResponse> outcomes;
  private List<String> unmatchedFields;
  private List<String> unassignedAttributes;

  /** Creates a RunReportResponse from a run report. */
  public static RunReportResponse from(RunReport report) {
    return RunReportResponse.builder()
        .pageId(report.pageId())
        .total(report.total())
        .filled(report.filled())
        .unmatched(report.unmatched())
        .failed(report.failed())
        .notAttempted(report.notAttempted())
        .cancelled(report.cancelled())
        .outcomes(report.outcomes().stream().map(FieldOutcomeResponse::from).toList())
        .unmatchedFields(report.unmatchedFieldIds())
        .unassignedAttributes(report.unassignedAttributePaths())
        .build();
  }
}
