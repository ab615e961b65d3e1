package com.scholary.synthjobs.admission;

import java.time.Duration;
import java.time.Instant;

/**
 * One fixed counting window for an admission key.
 *
 * <p>Immutable: every admission produces a new window value, so a counter never leaks from one
 * window into the next. The window covers {@code [windowStart, windowStart + windowDuration)}.
 */
public record RateLimitWindow(Instant windowStart, int count, int limit, Duration windowDuration) {

  public RateLimitWindow {
    if (count < 0 || count > limit) {
      throw new IllegalArgumentException(
          "count must be within [0, limit] (count: " + count + ", limit: " + limit + ")");
    }
  }

  /** Opens an empty window starting at {@code now}. */
  public static RateLimitWindow open(Instant now, OperationClassLimit classLimit) {
    return new RateLimitWindow(now, 0, classLimit.limit(), classLimit.window());
  }

  public Instant resetsAt() {
    return windowStart.plus(windowDuration);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(resetsAt());
  }

  public boolean canAdmit(int cost) {
    return count + cost <= limit;
  }

  public RateLimitWindow admit(int cost) {
    return new RateLimitWindow(windowStart, count + cost, limit, windowDuration);
  }

  public int remaining() {
    return limit - count;
  }

  /** Time left until this window resets, never negative. */
  public Duration retryAfter(Instant now) {
    Duration left = Duration.between(now, resetsAt());
    return left.isNegative() ? Duration.ZERO : left;
  }
}
