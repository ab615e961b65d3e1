package com.scholary.synthjobs.orchestrator;

import java.util.concurrent.CompletableFuture;

/**
 * Cancellation signal for one job.
 *
 * <p>The job's runner registers a listener when it starts, so a cancellation finishes the job at
 * once, whether it is waiting out a backoff delay or on a provider call.
 */
public final class CancellationToken {

  private final CompletableFuture<Void> signal = new CompletableFuture<>();

  /**
   * Request cancellation. Idempotent.
   *
   * @return true if this call flipped the token
   */
  public boolean cancel() {
    return signal.complete(null);
  }

  public boolean isCancelled() {
    return signal.isDone();
  }

  /**
   * Run {@code action} once the token is cancelled. It runs on the cancelling thread, or right
   * away on the caller's thread if the token is already cancelled.
   */
  public void onCancel(Runnable action) {
    signal.thenRun(action);
  }
}
