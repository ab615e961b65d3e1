package com.scholary.synthjobs.provider;

import com.scholary.synthjobs.job.JobPayload;

/**
 * Contract with the external compute provider.
 *
 * <p>Implementations make a single attempt per call and report failures by type: {@link
 * TransientProviderException} for anything worth retrying, {@link PermanentProviderException} for
 * rejections. Retries, backoff and deadlines belong to the orchestrator.
 */
public interface ExternalJobClient {

  /**
   * Submit a job.
   *
   * @param payload opaque job input
   * @return a handle to poll, or the finished output
   * @throws TransientProviderException on network failures, timeouts and 5xx-class responses
   * @throws PermanentProviderException if the provider rejects the payload
   */
  SubmitResult submit(JobPayload payload);

  /**
   * Query the status of a submitted job.
   *
   * @param externalRef the provider's handle
   * @return the current provider-side state
   * @throws TransientProviderException on network failures, timeouts and 5xx-class responses
   * @throws PermanentProviderException if the provider no longer knows the handle
   */
  ProviderStatus status(String externalRef);

  /** Whether {@link #cancel(String)} does anything. */
  default boolean supportsCancel() {
    return false;
  }

  /**
   * Ask the provider to stop working on a job. Best effort: there is no guarantee the provider
   * stops billing or working.
   *
   * @return true if the provider acknowledged the request
   */
  default boolean cancel(String externalRef) {
    return false;
  }
}
