package com.scholary.synthjobs.admission;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a single admission check.
 *
 * @param allowed whether the caller may proceed
 * @param retryAfter zero when allowed, otherwise the time until the window resets
 * @param remaining cost units left in the window after this decision
 * @param resetsAt end of the current window
 */
public record AdmissionDecision(
    boolean allowed, Duration retryAfter, int remaining, Instant resetsAt) {

  public static AdmissionDecision allowed(RateLimitWindow window) {
    return new AdmissionDecision(true, Duration.ZERO, window.remaining(), window.resetsAt());
  }

  public static AdmissionDecision denied(RateLimitWindow window, Instant now) {
    return new AdmissionDecision(
        false, window.retryAfter(now), window.remaining(), window.resetsAt());
  }

  public boolean denied() {
    return !allowed;
  }
}
