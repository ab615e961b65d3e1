package com.scholary.synthjobs.provider;

import java.util.Locale;

/** Provider-side job state, reduced to what the orchestrator acts on. */
public enum ProviderState {
  RUNNING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }

  /**
   * Map a provider's status label onto a state.
   *
   * <p>Providers disagree on vocabulary ({@code complete}, {@code succeeded}, {@code IN_QUEUE},
   * {@code processing}, ...). Anything unrecognised is treated as still running; the job deadline
   * bounds how long that can last.
   */
  public static ProviderState fromLabel(String label) {
    if (label == null) {
      return RUNNING;
    }
    return switch (label.trim().toLowerCase(Locale.ROOT)) {
      case "complete", "completed", "succeeded", "success" -> SUCCEEDED;
      case "failed", "error", "canceled", "cancelled" -> FAILED;
      default -> RUNNING;
    };
  }
}
