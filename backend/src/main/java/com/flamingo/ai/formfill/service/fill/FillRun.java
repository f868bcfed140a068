package com.flamingo.ai.formfill.service.fill;

import com.flamingo.ai.formfill.service.execute.CancellationToken;
import com.flamingo.ai.formfill.service.execute.RunReport;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to an asynchronous fill run. Cancelling stops the run before its next field; fields
 * already filled stay filled.
 */
public final class FillRun {

  private final CompletableFuture<RunReport> report;
  private final CancellationToken cancellation;

  FillRun(CompletableFuture<RunReport> report, CancellationToken cancellation) {
    this.report = report;
    this.cancellation = cancellation;
  }

  /** Completes with the run report, or exceptionally when the run failed before extraction. */
  public CompletableFuture<RunReport> report() {
    return report;
  }

  public void cancel() {
    cancellation.cancel();
  }

  public boolean isCancelled() {
    return cancellation.isCancelled();
  }
}
