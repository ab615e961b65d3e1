package com.scholary.synthjobs.api;

import com.scholary.synthjobs.admission.AdmissionDecision;
import java.time.Instant;

public record AdmissionCheckResponse(
    boolean allowed, long retryAfterSeconds, int remaining, Instant resetsAt) {

  public static AdmissionCheckResponse from(AdmissionDecision decision) {
    return new AdmissionCheckResponse(
        decision.allowed(),
        ApiExceptionHandler.toRetryAfterSeconds(decision.retryAfter()),
        decision.remaining(),
        decision.resetsAt());
  }
}
