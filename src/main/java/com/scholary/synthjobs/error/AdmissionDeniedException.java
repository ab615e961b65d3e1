package com.scholary.synthjobs.error;

import java.time.Duration;

/**
 * Thrown when a caller has used up its budget for an operation class in the current window.
 *
 * <p>Never retried automatically. Carries the time after which the same key may be admitted
 * again.
 */
public class AdmissionDeniedException extends RuntimeException {

  private final String admissionKey;
  private final Duration retryAfter;

  public AdmissionDeniedException(String admissionKey, Duration retryAfter) {
    super(
        String.format(
            "Admission denied for %s, retry after %d ms", admissionKey, retryAfter.toMillis()));
    this.admissionKey = admissionKey;
    this.retryAfter = retryAfter;
  }

  public String getAdmissionKey() {
    return admissionKey;
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }
}
