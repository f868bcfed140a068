package com.flamingo.ai.formfill.service.execute;

import com.flamingo.ai.formfill.service.match.FillPlan;
import java.util.List;

/**
 * Per-field outcomes of one run with summary counts.
 *
 * @param pageId the page that was filled
 * @param outcomes one outcome per plan entry, in document order
 * @param unmatchedFieldIds fields no attribute was assigned to
 * @param unassignedAttributePaths profile paths no field took
 * @param cancelled whether the run stopped early
 */
public record RunReport(
    String pageId,
    List<FillOutcome> outcomes,
    List<String> unmatchedFieldIds,
    List<String> unassignedAttributePaths,
    boolean cancelled) {

  public RunReport {
    outcomes = List.copyOf(outcomes);
    unmatchedFieldIds = List.copyOf(unmatchedFieldIds);
    unassignedAttributePaths = List.copyOf(unassignedAttributePaths);
  }

  static RunReport aggregate(
      String pageId, FillPlan plan, List<FillOutcome> outcomes, boolean cancelled) {
    return new RunReport(
        pageId, outcomes, plan.unmatchedFieldIds(), plan.unassignedAttributePaths(), cancelled);
  }

  public int total() {
    return outcomes.size();
  }

  public long filled() {
    return count(FillOutcome.Status.FILLED);
  }

  public long unmatched() {
    return count(FillOutcome.Status.SKIPPED_UNMATCHED);
  }

  public long failed() {
    return outcomes.stream().filter(FillOutcome::isFailure).count();
  }

  public long notAttempted() {
    return count(FillOutcome.Status.NOT_ATTEMPTED);
  }

  private long count(FillOutcome.Status status) {
    return outcomes.stream().filter(o -> o.status() == status).count();
  }
}
