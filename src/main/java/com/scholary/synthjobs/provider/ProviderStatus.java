package com.scholary.synthjobs.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answer to a status query.
 *
 * @param output present when {@code state} is {@link ProviderState#SUCCEEDED}
 * @param error provider-supplied reason when {@code state} is {@link ProviderState#FAILED}
 */
public record ProviderStatus(ProviderState state, JsonNode output, String error) {

  public static ProviderStatus running() {
    return new ProviderStatus(ProviderState.RUNNING, null, null);
  }

  public static ProviderStatus succeeded(JsonNode output) {
    return new ProviderStatus(ProviderState.SUCCEEDED, output, null);
  }

  public static ProviderStatus failed(String error) {
    return new ProviderStatus(ProviderState.FAILED, null, error);
  }
}
