package com.scholary.synthjobs.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answer to a submission: either a handle to poll, or the finished output when the provider
 * resolved the job synchronously.
 */
public record SubmitResult(String externalRef, JsonNode immediateOutput) {

  public SubmitResult {
    if (externalRef == null && immediateOutput == null) {
      throw new IllegalArgumentException("Either externalRef or immediateOutput is required");
    }
  }

  public static SubmitResult accepted(String externalRef) {
    return new SubmitResult(externalRef, null);
  }

  public static SubmitResult completed(String externalRef, JsonNode output) {
    return new SubmitResult(externalRef, output);
  }

  public boolean isImmediate() {
    return immediateOutput != null;
  }
}
