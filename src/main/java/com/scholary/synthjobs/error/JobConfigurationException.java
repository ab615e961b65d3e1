package com.scholary.synthjobs.error;

/**
 * Thrown synchronously, before any external call, when a request or the service configuration
 * cannot be honoured: a cost above the class limit, an unknown operation class, a deadline out of
 * range, or invalid backoff parameters.
 */
public class JobConfigurationException extends RuntimeException {

  public JobConfigurationException(String message) {
    super(message);
  }

  public JobConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
