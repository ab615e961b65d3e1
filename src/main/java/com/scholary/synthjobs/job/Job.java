package com.scholary.synthjobs.job;

import java.time.Instant;

/**
 * One submitted unit of external work.
 *
 * <p>Only the task that owns a job mutates it, so transitions for a single job are totally
 * ordered. Mutators and {@link #snapshot()} are synchronized so that status queries from other
 * threads always see a consistent view.
 *
 * <p>Once a terminal state is reached the job is frozen: later transition attempts are rejected,
 * which is what keeps a late provider answer from overwriting a timeout or cancellation.
 */
public class Job {

  private final String id;
  private final String admissionKey;
  private final JobPayload payload;
  private final Instant createdAt;
  private final Instant deadline;

  private JobState state;
  private String externalRef;
  private JobResult result;
  private JobError error;
  private int attempts;
  private Instant updatedAt;

  public Job(
      String id, String admissionKey, JobPayload payload, Instant createdAt, Instant deadline) {
    if (!deadline.isAfter(createdAt)) {
      throw new IllegalArgumentException("deadline must be after createdAt");
    }
    this.id = id;
    this.admissionKey = admissionKey;
    this.payload = payload;
    this.createdAt = createdAt;
    this.deadline = deadline;
    this.state = JobState.QUEUED;
    this.updatedAt = createdAt;
  }

  public String getId() {
    return id;
  }

  public String getAdmissionKey() {
    return admissionKey;
  }

  public JobPayload getPayload() {
    return payload;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getDeadline() {
    return deadline;
  }

  public synchronized JobState getState() {
    return state;
  }

  public synchronized String getExternalRef() {
    return externalRef;
  }

  public synchronized int getAttempts() {
    return attempts;
  }

  public synchronized boolean isTerminal() {
    return state.isTerminal();
  }

  /**
   * Move to a non-terminal state.
   *
   * @throws IllegalStateException if the transition is not allowed
   */
  public synchronized void transitionTo(JobState next, Instant now) {
    if (next.isTerminal()) {
      throw new IllegalArgumentException("Use succeed() or terminate() for terminal state " + next);
    }
    JobStateTransition.validate(state, next);
    state = next;
    updatedAt = now;
  }

  public synchronized void recordExternalRef(String ref, Instant now) {
    this.externalRef = ref;
    this.updatedAt = now;
  }

  public synchronized int incrementAttempts(Instant now) {
    attempts++;
    updatedAt = now;
    return attempts;
  }

  /**
   * Finish successfully.
   *
   * @return false if the job had already reached a terminal state
   */
  public synchronized boolean succeed(JobResult jobResult, Instant now) {
    if (state.isTerminal()) {
      return false;
    }
    JobStateTransition.validate(state, JobState.SUCCEEDED);
    state = JobState.SUCCEEDED;
    result = jobResult;
    updatedAt = now;
    return true;
  }

  /**
   * Finish in a non-success terminal state with a classified error.
   *
   * @return false if the job had already reached a terminal state
   */
  public synchronized boolean terminate(JobState terminal, JobError jobError, Instant now) {
    if (!terminal.isTerminal() || terminal == JobState.SUCCEEDED) {
      throw new IllegalArgumentException("Not a failure state: " + terminal);
    }
    if (jobError == null) {
      throw new IllegalArgumentException("A failed job must carry an error");
    }
    if (state.isTerminal()) {
      return false;
    }
    JobStateTransition.validate(state, terminal);
    state = terminal;
    error = jobError;
    updatedAt = now;
    return true;
  }

  public synchronized JobSnapshot snapshot() {
    return new JobSnapshot(
        id,
        admissionKey,
        state,
        externalRef,
        result,
        error,
        attempts,
        createdAt,
        updatedAt,
        deadline);
  }
}
