package com.scholary.synthjobs.provider;

/**
 * Base exception for provider calls.
 *
 * <p>The message is the provider's raw detail; it is logged but not shown to callers.
 */
public class ProviderException extends RuntimeException {

  public ProviderException(String message) {
    super(message);
  }

  public ProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
