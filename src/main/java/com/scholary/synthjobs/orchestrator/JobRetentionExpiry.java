package com.scholary.synthjobs.orchestrator;

import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-entry expiry for the tracking table.
 *
 * <p>A running job is kept until its deadline plus the retention window. Once it is terminal the
 * retention window restarts, so an uncollected result stays queryable for {@code retention} after
 * it was delivered. Reads do not extend the lifetime.
 */
class JobRetentionExpiry implements Expiry<String, TrackedJob> {

  private final Duration retention;
  private final Clock clock;

  JobRetentionExpiry(Duration retention, Clock clock) {
    this.retention = retention;
    this.clock = clock;
  }

  @Override
  public long expireAfterCreate(String jobId, TrackedJob tracked, long currentTime) {
    return lifetime(tracked);
  }

  @Override
  public long expireAfterUpdate(
      String jobId, TrackedJob tracked, long currentTime, long currentDuration) {
    return lifetime(tracked);
  }

  @Override
  public long expireAfterRead(
      String jobId, TrackedJob tracked, long currentTime, long currentDuration) {
    return currentDuration;
  }

  private long lifetime(TrackedJob tracked) {
    if (tracked.getJob().isTerminal()) {
      return retention.toNanos();
    }
    Instant now = clock.instant();
    Duration untilDeadline = Duration.between(now, tracked.getJob().getDeadline());
    if (untilDeadline.isNegative()) {
      untilDeadline = Duration.ZERO;
    }
    return untilDeadline.plus(retention).toNanos();
  }
}
