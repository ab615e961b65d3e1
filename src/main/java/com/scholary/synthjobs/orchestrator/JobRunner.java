package com.scholary.synthjobs.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.synthjobs.job.ErrorKind;
import com.scholary.synthjobs.job.Job;
import com.scholary.synthjobs.job.JobError;
import com.scholary.synthjobs.job.JobResult;
import com.scholary.synthjobs.job.JobState;
import com.scholary.synthjobs.logging.StructuredLogger;
import com.scholary.synthjobs.provider.ExternalJobClient;
import com.scholary.synthjobs.provider.PermanentProviderException;
import com.scholary.synthjobs.provider.ProviderStatus;
import com.scholary.synthjobs.provider.SubmitResult;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Drives one job from {@code SUBMITTING} to a terminal state as a chain of short steps.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Submit the payload, retrying transient failures with backoff up to the retry cap
 *   <li>If the provider answered with a result, finish immediately
 *   <li>Otherwise poll the provider's status with capped exponential backoff
 *   <li>Deliver the terminal outcome to the {@link ResultSink}
 * </ol>
 *
 * <p>No step blocks. A provider call runs on the provider executor and its outcome is handled by a
 * new step on the job executor. The delay before a retry or a poll is a task armed on the
 * scheduler. A job holds a job thread only while one of its steps runs, so a job waiting on
 * backoff or on the provider never holds up another job.
 *
 * <p>The deadline is a timer armed when the job starts and cancellation is a listener on the job's
 * token. Either one finishes the job at once and drops the pending step or call. Steps of one job
 * never overlap, and {@link Job} rejects any write after the first terminal state, so a step that
 * loses the race to the timer or the listener leaves the outcome alone.
 */
class JobRunner implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TrackedJob tracked;
  private final Job job;
  private final ExternalJobClient client;
  private final PollScheduler scheduler;
  private final ResultSink sink;
  private final Executor jobExecutor;
  private final TaskScheduler taskScheduler;
  private final Executor providerExecutor;
  private final int maxSubmissionRetries;
  private final Clock clock;

  // Step state; each step hands off to the next through an executor
  private int submissions;
  private int pollAttempt;
  private String externalRef;

  private volatile Future<?> deadlineTimer;
  private volatile Future<?> pendingStep;
  private volatile Future<?> inFlight;

  JobRunner(
      TrackedJob tracked,
      ExternalJobClient client,
      PollScheduler scheduler,
      ResultSink sink,
      Executor jobExecutor,
      TaskScheduler taskScheduler,
      Executor providerExecutor,
      int maxSubmissionRetries,
      Clock clock) {
    this.tracked = tracked;
    this.job = tracked.getJob();
    this.client = client;
    this.scheduler = scheduler;
    this.sink = sink;
    this.jobExecutor = jobExecutor;
    this.taskScheduler = taskScheduler;
    this.providerExecutor = providerExecutor;
    this.maxSubmissionRetries = maxSubmissionRetries;
    this.clock = clock;
  }

  @Override
  public void run() {
    if (!tracked.claim()) {
      LOGGER.debug("Job was cancelled before its task started: jobId={}", job.getId());
      return;
    }
    step(this::start);
  }

  private void start() {
    tracked
        .getCancellation()
        .onCancel(() -> step(() -> finish(JobState.CANCELLED, JobError.cancelled())));
    deadlineTimer = taskScheduler.schedule(() -> step(this::deadlineReached), job.getDeadline());
    if (job.isTerminal()) {
      deadlineTimer.cancel(false);
      return;
    }
    submitAttempt();
  }

  private void submitAttempt() {
    if (halted()) {
      return;
    }
    submissions++;
    job.incrementAttempts(clock.instant());
    callProvider(() -> client.submit(job.getPayload()), this::onSubmitted);
  }

  private void onSubmitted(SubmitResult result, Throwable failure) {
    if (failure != null) {
      if (failure instanceof PermanentProviderException) {
        LOGGER.warn(
            "Provider rejected submission: jobId={}, error={}", job.getId(), failure.getMessage());
        finish(
            JobState.FAILED,
            JobError.of(ErrorKind.PERMANENT_PROVIDER_ERROR, "Provider rejected the job"));
        return;
      }
      // Transport failures and anything unclassified are retried
      if (submissions > maxSubmissionRetries) {
        LOGGER.error(
            "Submission retries exhausted: jobId={}, attempts={}, lastError={}",
            job.getId(),
            submissions,
            failure.getMessage());
        finish(
            JobState.FAILED,
            JobError.of(
                ErrorKind.TRANSIENT_PROVIDER_ERROR,
                "Provider unavailable after " + submissions + " submission attempts"));
        return;
      }
      structuredLogger.logSubmitRetry(
          job.getId(),
          submissions,
          maxSubmissionRetries,
          failure.getClass().getSimpleName(),
          failure.getMessage());
      scheduleNext(submissions - 1, this::submitAttempt);
      return;
    }

    if (result.externalRef() != null) {
      job.recordExternalRef(result.externalRef(), clock.instant());
    }
    if (result.isImmediate()) {
      complete(result.immediateOutput());
      return;
    }
    externalRef = result.externalRef();
    transition(JobState.POLLING);
    pollAttempt = 0;
    scheduleNext(pollAttempt, this::pollOnce);
  }

  private void pollOnce() {
    if (halted()) {
      return;
    }
    job.incrementAttempts(clock.instant());
    String ref = externalRef;
    callProvider(() -> client.status(ref), this::onStatus);
  }

  private void onStatus(ProviderStatus status, Throwable failure) {
    if (failure != null) {
      if (failure instanceof PermanentProviderException) {
        LOGGER.warn(
            "Provider status failed: jobId={}, error={}", job.getId(), failure.getMessage());
        finish(
            JobState.FAILED,
            JobError.of(ErrorKind.PERMANENT_PROVIDER_ERROR, "Provider could not report status"));
        return;
      }
      structuredLogger.logPollFailed(
          job.getId(), pollAttempt, failure.getClass().getSimpleName(), failure.getMessage());
      pollAgain();
      return;
    }

    switch (status.state()) {
      case SUCCEEDED -> complete(status.output());
      case FAILED -> {
        LOGGER.warn("Provider reported failure: jobId={}, error={}", job.getId(), status.error());
        finish(
            JobState.FAILED,
            JobError.of(ErrorKind.PERMANENT_PROVIDER_ERROR, "Provider reported the job failed"));
      }
      case RUNNING -> pollAgain();
    }
  }

  private void pollAgain() {
    pollAttempt++;
    scheduleNext(pollAttempt, this::pollOnce);
  }

  /** Accept a result unless it arrived at or after the deadline. */
  private void complete(JsonNode output) {
    if (!clock.instant().isBefore(job.getDeadline())) {
      LOGGER.info("Discarding result that arrived after the deadline: jobId={}", job.getId());
      finish(JobState.TIMED_OUT, JobError.deadlineExceeded());
      return;
    }
    succeed(output == null ? null : new JobResult(output));
  }

  /** Arm the next step after the backoff delay for {@code attempt}, or time out. */
  private void scheduleNext(int attempt, Runnable next) {
    Optional<PollAttempt> planned = scheduler.plan(attempt, job.getDeadline(), clock.instant());
    if (planned.isEmpty()) {
      finish(JobState.TIMED_OUT, JobError.deadlineExceeded());
      return;
    }
    Duration delay = planned.get().delay();
    structuredLogger.logPollScheduled(job.getId(), attempt, delay);

    ScheduledFuture<?> armed =
        taskScheduler.schedule(() -> dispatch(next), clock.instant().plus(delay));
    pendingStep = armed;
    if (job.isTerminal()) {
      armed.cancel(false);
    }
  }

  /**
   * Run one provider call on the provider executor and handle its outcome in a later step.
   *
   * <p>The handler receives the unwrapped failure, and is skipped when the job finished while the
   * call was in flight.
   */
  private <T> void callProvider(Supplier<T> providerCall, BiConsumer<T, Throwable> handler) {
    CompletableFuture<T> work = CompletableFuture.supplyAsync(providerCall, providerExecutor);
    inFlight = work;
    if (job.isTerminal()) {
      work.cancel(false);
      return;
    }
    work.whenComplete(
        (value, failure) ->
            dispatch(
                () -> {
                  if (job.isTerminal()) {
                    LOGGER.debug(
                        "Ignoring provider answer for finished job: jobId={}, state={}",
                        job.getId(),
                        job.getState());
                    return;
                  }
                  handler.accept(value, unwrap(failure));
                }));
  }

  /** Hand a step to the job executor. */
  private void dispatch(Runnable body) {
    try {
      jobExecutor.execute(() -> step(body));
    } catch (RejectedExecutionException e) {
      step(
          () -> {
            LOGGER.error("Job executor rejected a step: jobId={}", job.getId(), e);
            finish(
                JobState.FAILED,
                JobError.of(ErrorKind.TRANSIENT_PROVIDER_ERROR, "Service is at capacity"));
          });
    }
  }

  /** Run one step with the job's logging context, turning any failure into a terminal state. */
  private void step(Runnable body) {
    StructuredLogger.setJobContext(job.getId(), job.getAdmissionKey());
    try {
      body.run();
    } catch (RejectedExecutionException e) {
      LOGGER.error("Could not schedule the next step: jobId={}", job.getId(), e);
      finish(
          JobState.FAILED,
          JobError.of(ErrorKind.TRANSIENT_PROVIDER_ERROR, "Service is at capacity"));
    } catch (RuntimeException e) {
      if (job.isTerminal()) {
        LOGGER.debug(
            "Step stopped by job termination: jobId={}, error={}", job.getId(), e.getMessage());
      } else {
        LOGGER.error("Job step failed unexpectedly: jobId={}", job.getId(), e);
        finish(
            JobState.FAILED,
            JobError.of(ErrorKind.TRANSIENT_PROVIDER_ERROR, "Job failed unexpectedly"));
      }
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void deadlineReached() {
    if (!job.isTerminal()) {
      LOGGER.info("Deadline reached: jobId={}, state={}", job.getId(), job.getState());
    }
    finish(JobState.TIMED_OUT, JobError.deadlineExceeded());
  }

  /**
   * Check-in point before every provider call.
   *
   * @return true if the job was cancelled or ran out of time and is now terminal
   */
  private boolean halted() {
    if (tracked.getCancellation().isCancelled()) {
      finish(JobState.CANCELLED, JobError.cancelled());
      return true;
    }
    if (!clock.instant().isBefore(job.getDeadline())) {
      finish(JobState.TIMED_OUT, JobError.deadlineExceeded());
      return true;
    }
    return job.isTerminal();
  }

  private void transition(JobState next) {
    JobState from = job.getState();
    job.transitionTo(next, clock.instant());
    structuredLogger.logJobTransition(job.getId(), from, next);
  }

  private void succeed(JobResult result) {
    JobState from = job.getState();
    if (job.succeed(result, clock.instant())) {
      structuredLogger.logJobTransition(job.getId(), from, JobState.SUCCEEDED);
      dropPending();
      sink.deliver(tracked);
    }
  }

  private void finish(JobState terminal, JobError error) {
    JobState from = job.getState();
    if (!job.terminate(terminal, error, clock.instant())) {
      return;
    }
    structuredLogger.logJobTransition(job.getId(), from, terminal);
    dropPending();
    if (terminal == JobState.TIMED_OUT || terminal == JobState.CANCELLED) {
      cancelUpstream();
    }
    sink.deliver(tracked);
  }

  private void dropPending() {
    cancel(deadlineTimer);
    cancel(pendingStep);
    cancel(inFlight);
  }

  private static void cancel(Future<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }

  private static Throwable unwrap(Throwable failure) {
    if (failure instanceof CompletionException && failure.getCause() != null) {
      return failure.getCause();
    }
    return failure;
  }

  /** Ask the provider to stop working on the job without waiting for the answer. */
  private void cancelUpstream() {
    String ref = job.getExternalRef();
    if (ref == null || !client.supportsCancel()) {
      return;
    }
    try {
      CompletableFuture.supplyAsync(() -> client.cancel(ref), providerExecutor)
          .whenComplete(
              (acknowledged, failure) -> {
                if (failure != null) {
                  LOGGER.warn(
                      "Upstream cancel failed: jobId={}, externalRef={}, error={}",
                      job.getId(),
                      ref,
                      failure.getMessage());
                } else if (!Boolean.TRUE.equals(acknowledged)) {
                  LOGGER.info(
                      "Upstream cancel not acknowledged: jobId={}, externalRef={}",
                      job.getId(),
                      ref);
                }
              });
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Could not schedule upstream cancel: jobId={}, error={}", job.getId(), e.getMessage());
    }
  }
}
