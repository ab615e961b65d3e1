package com.scholary.synthjobs.job;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** Opaque job input, forwarded to the provider as-is. */
public record JobPayload(JsonNode body) {

  public JobPayload {
    Objects.requireNonNull(body, "body");
  }
}
