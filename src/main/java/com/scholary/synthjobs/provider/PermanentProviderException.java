package com.scholary.synthjobs.provider;

/** The provider rejected the request as invalid or unsupported. Never retried. */
public class PermanentProviderException extends ProviderException {

  public PermanentProviderException(String message) {
    super(message);
  }

  public PermanentProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
