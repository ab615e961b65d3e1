package com.scholary.synthjobs.provider;

/** Network failure, timeout or 5xx-class response. Worth retrying. */
public class TransientProviderException extends ProviderException {

  public TransientProviderException(String message) {
    super(message);
  }

  public TransientProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
