package com.scholary.synthjobs.orchestrator;

import com.scholary.synthjobs.job.Job;
import com.scholary.synthjobs.job.JobSnapshot;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/** Entry in the tracking table: a job together with the handles used to stop and await it. */
public class TrackedJob {

  private final Job job;
  private final CancellationToken cancellation = new CancellationToken();
  private final CompletableFuture<JobSnapshot> completion = new CompletableFuture<>();
  private final AtomicBoolean claimed = new AtomicBoolean();
  private volatile Future<?> task;

  public TrackedJob(Job job) {
    this.job = job;
  }

  public Job getJob() {
    return job;
  }

  public CancellationToken getCancellation() {
    return cancellation;
  }

  /** Completes once, with the terminal snapshot. */
  public CompletableFuture<JobSnapshot> getCompletion() {
    return completion;
  }

  public Future<?> getTask() {
    return task;
  }

  void setTask(Future<?> task) {
    this.task = task;
  }

  /**
   * Take ownership of the job's execution. Exactly one caller wins: either the task when it
   * starts, or a cancellation that arrives while the task is still queued.
   *
   * @return true for the single winning caller
   */
  boolean claim() {
    return claimed.compareAndSet(false, true);
  }
}
