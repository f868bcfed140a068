package com.flamingo.ai.formfill.service.execute;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.exception.FieldTimeoutException;
import com.flamingo.ai.formfill.exception.PageBusyException;
import com.flamingo.ai.formfill.page.FormPage;
import com.flamingo.ai.formfill.service.match.FillPlan;
import com.flamingo.ai.formfill.service.match.FillPlanEntry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies a fill plan to a live page and verifies every value it sets.
 *
 * <p>Entries run in document order. Each assigned value is applied, change events are fired and
 * the field is read back. A mismatch or a failed interaction is retried up to the configured
 * number of retries; a timeout is not. Field errors become outcomes and never stop the run. A page
 * is owned by one run at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FillExecutor {

  private final FormFillConfig config;
  private final MeterRegistry meterRegistry;
  private final Set<String> leasedPages = ConcurrentHashMap.newKeySet();

  /**
   * Executes the plan.
   *
   * @param page the page the plan was extracted from
   * @param plan the fill plan
   * @param cancellation checked before every field
   * @return the run report
   * @throws PageBusyException if another run currently owns the page
   */
  public RunReport execute(FormPage page, FillPlan plan, CancellationToken cancellation) {
    String pageId = page.pageId();
    if (!leasedPages.add(pageId)) {
      throw new PageBusyException(pageId);
    }
    try {
      List<FillOutcome> outcomes = new ArrayList<>();
      boolean cancelled = false;
      for (FillPlanEntry entry : plan.entries()) {
        cancelled = cancelled || cancellation.isCancelled();
        FillOutcome outcome = cancelled ? skipCancelled(entry) : executeEntry(page, entry);
        record(outcome);
        outcomes.add(outcome);
      }

      RunReport report = RunReport.aggregate(pageId, plan, outcomes, cancelled);
      log.info(
          "Fill run on page {} finished: total={}, filled={}, unmatched={}, failed={},"
              + " notAttempted={}",
          pageId,
          report.total(),
          report.filled(),
          report.unmatched(),
          report.failed(),
          report.notAttempted());
      return report;
    } finally {
      leasedPages.remove(pageId);
    }
  }

  private FillOutcome skipCancelled(FillPlanEntry entry) {
    return switch (entry.status()) {
      case UNMATCHED -> FillOutcome.skippedUnmatched(entry);
      case INCOERCIBLE -> coercionFailed(entry);
      case ASSIGNED -> FillOutcome.notAttempted(entry);
    };
  }

  private FillOutcome executeEntry(FormPage page, FillPlanEntry entry) {
    return switch (entry.status()) {
      case UNMATCHED -> FillOutcome.skippedUnmatched(entry);
      case INCOERCIBLE -> coercionFailed(entry);
      case ASSIGNED -> fillField(page, entry);
    };
  }

  private FillOutcome coercionFailed(FillPlanEntry entry) {
    return FillOutcome.executionFailed(
        entry,
        entry.coercionFailure().getKind() + ": " + entry.coercionFailure().getMessage(),
        0);
  }

  private FillOutcome fillField(FormPage page, FillPlanEntry entry) {
    FieldDescriptor field = entry.field();
    CoercedValue expected = entry.coercedValue();
    Duration timeout = config.getExecution().getFieldTimeout();
    int maxAttempts = 1 + Math.max(0, config.getExecution().getVerificationRetries());

    int attempts = 0;
    List<String> observed = List.of();
    RuntimeException lastError = null;
    while (attempts < maxAttempts) {
      attempts++;
      try {
        page.awaitInteractable(field, timeout);
        page.apply(field, expected);
        page.dispatchChangeEvents(field);
        observed = page.read(field);
      } catch (FieldTimeoutException e) {
        // the bounded wait is spent; another attempt would wait again
        log.warn("Field {} timed out: {}", field.id(), e.getMessage());
        return FillOutcome.executionFailed(entry, "Timeout: " + e.getMessage(), attempts);
      } catch (RuntimeException e) {
        lastError = e;
        log.debug("Field {} failed on attempt {}: {}", field.id(), attempts, e.getMessage());
        continue;
      }
      lastError = null;
      if (expected.matches(observed)) {
        log.debug("Field {} filled after {} attempt(s)", field.id(), attempts);
        return FillOutcome.filled(entry, attempts);
      }
      log.debug(
          "Field {} shows {} instead of {} (attempt {})",
          field.id(),
          observed,
          expected.values(),
          attempts);
    }

    if (lastError != null) {
      log.warn("Field {} could not be filled: {}", field.id(), lastError.getMessage(), lastError);
      return FillOutcome.executionFailed(
          entry, lastError.getClass().getSimpleName() + ": " + lastError.getMessage(), attempts);
    }
    log.warn(
        "Field {} failed verification: expected '{}', observed '{}'",
        field.id(),
        expected.display(),
        String.join(", ", observed));
    return FillOutcome.verificationFailed(entry, String.join(", ", observed), attempts);
  }

  private void record(FillOutcome outcome) {
    meterRegistry
        .counter("formfill.fields", "outcome", outcome.status().name().toLowerCase(Locale.ROOT))
        .increment();
  }
}
