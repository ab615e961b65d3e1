package com.scholary.synthjobs.orchestrator;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.synthjobs.config.OrchestratorProperties;
import com.scholary.synthjobs.error.JobNotFoundException;
import com.scholary.synthjobs.error.OrchestratorSaturatedException;
import com.scholary.synthjobs.job.JobHandle;
import com.scholary.synthjobs.job.JobSnapshot;
import com.scholary.synthjobs.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tracking table and delivery point for job outcomes.
 *
 * <p>Uses a Caffeine cache with a per-entry expiry, ticking on the same {@link Clock} as the job
 * deadlines. A terminal entry is removed the first time a caller reads it, or after the retention
 * window if nobody does. The table is bounded: once it holds {@code maxTrackedJobs} entries new
 * jobs are refused instead of evicting live ones.
 */
@Component
public class ResultSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResultSink.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final Cache<String, TrackedJob> cache;
  private final int maxTrackedJobs;

  @Autowired
  public ResultSink(OrchestratorProperties properties, Clock clock) {
    this(properties.retention(), properties.maxTrackedJobs(), clock);
  }

  public ResultSink(Duration retention, int maxTrackedJobs, Clock clock) {
    this.maxTrackedJobs = maxTrackedJobs;
    Ticker ticker = () -> toEpochNanos(clock.instant());
    this.cache =
        Caffeine.newBuilder()
            .ticker(ticker)
            .expireAfter(new JobRetentionExpiry(retention, clock))
            .build();
  }

  /**
   * Start tracking a job.
   *
   * @throws OrchestratorSaturatedException if the table is full
   */
  public synchronized void register(TrackedJob tracked) {
    if (cache.estimatedSize() >= maxTrackedJobs) {
      cache.cleanUp();
      if (cache.estimatedSize() >= maxTrackedJobs) {
        throw new OrchestratorSaturatedException(
            "Too many tracked jobs (limit: " + maxTrackedJobs + ")");
      }
    }
    cache.put(tracked.getJob().getId(), tracked);
  }

  public Optional<TrackedJob> find(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /**
   * Publish a job's terminal outcome. Waiters on the completion signal are released and the
   * entry's retention window restarts.
   */
  public void deliver(TrackedJob tracked) {
    JobSnapshot snapshot = tracked.getJob().snapshot();
    if (!snapshot.isTerminal()) {
      throw new IllegalStateException("Job " + snapshot.jobId() + " is not terminal");
    }
    if (!tracked.getCompletion().complete(snapshot)) {
      return;
    }

    // Re-insert so the expiry is recomputed for the terminal state
    cache.asMap().replace(snapshot.jobId(), tracked, tracked);

    long elapsedMs = Duration.between(snapshot.createdAt(), snapshot.updatedAt()).toMillis();
    structuredLogger.logJobDelivered(
        snapshot.jobId(), snapshot.state(), snapshot.attempts(), elapsedMs);
  }

  /**
   * Current view of a job. A terminal view counts as collected and removes the entry.
   *
   * @throws JobNotFoundException if the handle is unknown or already evicted
   */
  public JobSnapshot fetch(JobHandle handle) {
    TrackedJob tracked = require(handle);
    JobSnapshot snapshot = tracked.getJob().snapshot();
    if (snapshot.isTerminal()) {
      evict(tracked);
    }
    return snapshot;
  }

  /**
   * Wait up to {@code maxWait} for a job to finish.
   *
   * <p>Returns the terminal snapshot (and removes the entry) if the job finishes in time, or the
   * current non-terminal snapshot otherwise, in which case the caller continues with the handle.
   *
   * @throws JobNotFoundException if the handle is unknown or already evicted
   */
  public JobSnapshot await(JobHandle handle, Duration maxWait) {
    TrackedJob tracked = require(handle);
    try {
      JobSnapshot snapshot = tracked.getCompletion().get(maxWait.toNanos(), TimeUnit.NANOSECONDS);
      evict(tracked);
      return snapshot;
    } catch (TimeoutException e) {
      LOGGER.info(
          "Job still running after {}ms, handing back the handle: jobId={}",
          maxWait.toMillis(),
          handle.jobId());
      return tracked.getJob().snapshot();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while waiting for job: jobId={}", handle.jobId());
      return tracked.getJob().snapshot();
    } catch (ExecutionException e) {
      throw new IllegalStateException("Completion signal failed for job " + handle.jobId(), e);
    }
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private TrackedJob require(JobHandle handle) {
    return find(handle.jobId()).orElseThrow(() -> new JobNotFoundException(handle.jobId()));
  }

  void remove(TrackedJob tracked) {
    cache.asMap().remove(tracked.getJob().getId(), tracked);
  }

  private void evict(TrackedJob tracked) {
    if (cache.asMap().remove(tracked.getJob().getId(), tracked)) {
      LOGGER.debug("Evicted collected job: jobId={}", tracked.getJob().getId());
    }
  }

  private static long toEpochNanos(Instant instant) {
    return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
  }
}
