package com.flamingo.ai.formfill.service.execute;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldKind;
import com.flamingo.ai.formfill.domain.form.RawFormControl;
import com.flamingo.ai.formfill.exception.FieldInteractionException;
import com.flamingo.ai.formfill.exception.FieldTimeoutException;
import com.flamingo.ai.formfill.exception.IncoercibleValueException;
import com.flamingo.ai.formfill.exception.PageBusyException;
import com.flamingo.ai.formfill.page.FormPage;
import com.flamingo.ai.formfill.service.match.FillPlan;
import com.flamingo.ai.formfill.service.match.FillPlanEntry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FillExecutorTest {

  private SimpleMeterRegistry meterRegistry;
  private FillExecutor executor;
  private FakePage page;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new FillExecutor(new FormFillConfig(), meterRegistry);
    page = new FakePage("page-1");
  }

  @Test
  void shouldFillAndVerifyEveryAssignedField() {
    // Given
    FillPlan plan = plan(assigned("name", "Jane Doe"), assigned("email", "jane@x.com"));

    // When
    RunReport report = executor.execute(page, plan, new CancellationToken());

    // Then
    assertThat(report.outcomes())
        .extracting(FillOutcome::status)
        .containsExactly(FillOutcome.Status.FILLED, FillOutcome.Status.FILLED);
    assertThat(report.filled()).isEqualTo(2);
    assertThat(report.cancelled()).isFalse();
    assertThat(page.values).containsEntry("name", List.of("Jane Doe"));
    assertThat(meterRegistry.get("formfill.fields").tag("outcome", "filled").counter().count())
        .isEqualTo(2.0);
  }

  @Test
  @DisplayName("should report a field the page clears as VerificationFailed and go on")
  void shouldReportClearedFieldAsVerificationFailed() {
    // Given
    page.clearedAfterChange.add("email");
    FillPlan plan =
        plan(assigned("name", "Jane Doe"), assigned("email", "jane@x.com"), unmatched("q1"));

    // When
    RunReport report = executor.execute(page, plan, new CancellationToken());

    // Then
    FillOutcome email = report.outcomes().get(1);
    assertThat(email.status()).isEqualTo(FillOutcome.Status.VERIFICATION_FAILED);
    assertThat(email.attempts()).isEqualTo(2);
    assertThat(email.expected()).isEqualTo("jane@x.com");
    assertThat(email.observed()).isEmpty();
    assertThat(report.outcomes().get(0).status()).isEqualTo(FillOutcome.Status.FILLED);
    assertThat(report.outcomes().get(2).status()).isEqualTo(FillOutcome.Status.SKIPPED_UNMATCHED);
    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.unmatchedFieldIds()).containsExactly("q1");
  }

  @Test
  void shouldTurnTimeoutIntoFieldFailure() {
    page.neverInteractable.add("name");
    FillPlan plan = plan(assigned("name", "Jane Doe"), assigned("email", "jane@x.com"));

    RunReport report = executor.execute(page, plan, new CancellationToken());

    assertThat(report.outcomes().get(0).status()).isEqualTo(FillOutcome.Status.EXECUTION_FAILED);
    assertThat(report.outcomes().get(0).cause()).startsWith("Timeout:");
    assertThat(report.outcomes().get(1).status()).isEqualTo(FillOutcome.Status.FILLED);
  }

  @Test
  @DisplayName("should retry a field whose first apply throws and report it filled")
  void shouldRetryInteractionErrorOnNextAttempt() {
    // Given
    int[] calls = {0};
    page.onApply =
        field -> {
          if (calls[0]++ == 0) {
            throw new FieldInteractionException(field.id(), "element detached");
          }
        };

    // When
    RunReport report =
        executor.execute(page, plan(assigned("name", "Jane Doe")), new CancellationToken());

    // Then
    FillOutcome outcome = report.outcomes().get(0);
    assertThat(outcome.status()).isEqualTo(FillOutcome.Status.FILLED);
    assertThat(outcome.attempts()).isEqualTo(2);
    assertThat(page.values).containsEntry("name", List.of("Jane Doe"));
  }

  @Test
  void shouldTurnPersistentInteractionErrorIntoFieldFailure() {
    page.onApply =
        field -> {
          throw new FieldInteractionException(field.id(), "element detached");
        };

    RunReport report =
        executor.execute(page, plan(assigned("name", "Jane Doe")), new CancellationToken());

    FillOutcome outcome = report.outcomes().get(0);
    assertThat(outcome.status()).isEqualTo(FillOutcome.Status.EXECUTION_FAILED);
    assertThat(outcome.cause()).isEqualTo("FieldInteractionException: element detached");
    assertThat(outcome.attempts()).isEqualTo(2);
  }

  @Test
  void shouldNotRetryTimedOutField() {
    page.neverInteractable.add("name");

    RunReport report =
        executor.execute(page, plan(assigned("name", "Jane Doe")), new CancellationToken());

    assertThat(report.outcomes().get(0).attempts()).isEqualTo(1);
    assertThat(page.applied).isEmpty();
  }

  @Test
  void shouldReportIncoercibleEntryWithoutTouchingThePage() {
    FieldDescriptor field = field("grad", FieldKind.DATE);
    FillPlanEntry incoercible =
        new FillPlanEntry(
            field,
            FillPlanEntry.Status.INCOERCIBLE,
            "education[0].endDate",
            null,
            1.0,
            "labelSimilarity",
            new IncoercibleValueException("grad", "Open-ended date 'Present'"));

    RunReport report = executor.execute(page, plan(incoercible), new CancellationToken());

    FillOutcome outcome = report.outcomes().get(0);
    assertThat(outcome.status()).isEqualTo(FillOutcome.Status.EXECUTION_FAILED);
    assertThat(outcome.cause()).isEqualTo("IncoercibleValue: Open-ended date 'Present'");
    assertThat(outcome.attempts()).isZero();
    assertThat(page.applied).isEmpty();
  }

  @Test
  void shouldMarkRemainingFieldsNotAttemptedAfterCancellation() {
    // Given
    CancellationToken cancellation = new CancellationToken();
    page.onApply = field -> cancellation.cancel();
    FillPlan plan =
        plan(assigned("name", "Jane Doe"), unmatched("q1"), assigned("email", "jane@x.com"));

    // When
    RunReport report = executor.execute(page, plan, cancellation);

    // Then
    assertThat(report.outcomes())
        .extracting(FillOutcome::status)
        .containsExactly(
            FillOutcome.Status.FILLED,
            FillOutcome.Status.SKIPPED_UNMATCHED,
            FillOutcome.Status.NOT_ATTEMPTED);
    assertThat(report.cancelled()).isTrue();
    assertThat(report.notAttempted()).isEqualTo(1);
    assertThat(page.values).containsKey("name").doesNotContainKey("email");
  }

  @Test
  void shouldFillAgainWithoutMismatchesOnSecondPass() {
    FillPlan plan = plan(assigned("name", "Jane Doe"), assigned("email", "jane@x.com"));
    executor.execute(page, plan, new CancellationToken());

    RunReport second = executor.execute(page, plan, new CancellationToken());

    assertThat(second.outcomes())
        .allSatisfy(
            outcome -> {
              assertThat(outcome.status()).isEqualTo(FillOutcome.Status.FILLED);
              assertThat(outcome.attempts()).isEqualTo(1);
            });
  }

  @Test
  void shouldRejectSecondRunOnLeasedPage() {
    // Given
    FillPlan plan = plan(assigned("name", "Jane Doe"));
    List<RuntimeException> nestedFailures = new ArrayList<>();
    page.onApply =
        field -> {
          try {
            executor.execute(page, plan, new CancellationToken());
          } catch (PageBusyException e) {
            nestedFailures.add(e);
          }
        };

    // When
    RunReport report = executor.execute(page, plan, new CancellationToken());

    // Then
    assertThat(nestedFailures).singleElement().isInstanceOf(PageBusyException.class);
    assertThat(report.filled()).isEqualTo(1);
  }

  private static FillPlan plan(FillPlanEntry... entries) {
    return new FillPlan(List.of(entries), List.of());
  }

  private static FillPlanEntry assigned(String id, String text) {
    return new FillPlanEntry(
        field(id, FieldKind.TEXT),
        FillPlanEntry.Status.ASSIGNED,
        id,
        CoercedValue.text(FieldKind.TEXT, text),
        1.0,
        "exactToken",
        null);
  }

  private static FillPlanEntry unmatched(String id) {
    return new FillPlanEntry(
        field(id, FieldKind.TEXT), FillPlanEntry.Status.UNMATCHED, null, null, 0.0, null, null);
  }

  private static FieldDescriptor field(String id, FieldKind kind) {
    return FieldDescriptor.builder().id(id).kind(kind).label(id).build();
  }

  /** In-memory page whose fields can be made to time out or be cleared by page scripts. */
  private static final class FakePage implements FormPage {

    private final String pageId;
    private final Map<String, List<String>> values = new HashMap<>();
    private final Set<String> clearedAfterChange = new HashSet<>();
    private final Set<String> neverInteractable = new HashSet<>();
    private final List<String> applied = new ArrayList<>();
    private Consumer<FieldDescriptor> onApply = field -> {};

    private FakePage(String pageId) {
      this.pageId = pageId;
    }

    @Override
    public String pageId() {
      return pageId;
    }

    @Override
    public List<RawFormControl> inspectControls(Duration timeout) {
      return List.of();
    }

    @Override
    public void awaitInteractable(FieldDescriptor field, Duration timeout) {
      if (neverInteractable.contains(field.id())) {
        throw new FieldTimeoutException(field.id(), timeout, null);
      }
    }

    @Override
    public void apply(FieldDescriptor field, CoercedValue value) {
      applied.add(field.id());
      onApply.accept(field);
      values.put(field.id(), value.values());
    }

    @Override
    public void dispatchChangeEvents(FieldDescriptor field) {
      if (clearedAfterChange.contains(field.id())) {
        values.put(field.id(), List.of(""));
      }
    }

    @Override
    public List<String> read(FieldDescriptor field) {
      return values.getOrDefault(field.id(), List.of(""));
    }
  }
}
