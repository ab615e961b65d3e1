package com.scholary.synthjobs.job;

/** Classification attached to every job that does not end in {@link JobState#SUCCEEDED}. */
public enum ErrorKind {
  /** The caller exceeded its quota. Not retried. */
  ADMISSION_DENIED,
  /** Network failure, 5xx-class response or timeout talking to the provider. Retried. */
  TRANSIENT_PROVIDER_ERROR,
  /** The provider rejected the payload or reported the job as failed. Never retried. */
  PERMANENT_PROVIDER_ERROR,
  /** The job's wall-clock budget elapsed. */
  DEADLINE_EXCEEDED,
  /** The caller withdrew interest. */
  CANCELLATION_REQUESTED,
  /** The request or configuration could not be honoured. */
  CONFIGURATION_ERROR
}
