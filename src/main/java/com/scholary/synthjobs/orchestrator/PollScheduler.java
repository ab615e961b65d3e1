package com.scholary.synthjobs.orchestrator;

import com.scholary.synthjobs.error.JobConfigurationException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Capped exponential backoff with jitter, bounded by a job's deadline.
 *
 * <pre>
 * delay = min(base * 2^attempt, maxDelay) * (1 + jitterFraction * u),  u uniform in [-1, 1)
 * delay = clamp(delay, 0, maxDelay)
 * </pre>
 *
 * <p>With {@code base=1s, maxDelay=10s} a job is polled after roughly 1, 2, 4, 8, 10, 10, ...
 * seconds. The jitter keeps many jobs submitted together from polling in lockstep.
 */
public class PollScheduler {

  private final Duration base;
  private final Duration maxDelay;
  private final double jitterFraction;
  private final DoubleSupplier random;

  public PollScheduler(Duration base, Duration maxDelay, double jitterFraction) {
    this(base, maxDelay, jitterFraction, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param random source of uniform values in {@code [0, 1)}
   * @throws JobConfigurationException if the parameters are invalid
   */
  public PollScheduler(
      Duration base, Duration maxDelay, double jitterFraction, DoubleSupplier random) {
    if (base == null || base.isZero() || base.isNegative()) {
      throw new JobConfigurationException("base must be positive (current: " + base + ")");
    }
    if (maxDelay == null || maxDelay.compareTo(base) < 0) {
      throw new JobConfigurationException(
          "maxDelay must be >= base (base: " + base + ", max: " + maxDelay + ")");
    }
    if (jitterFraction < 0.0 || jitterFraction >= 1.0) {
      throw new JobConfigurationException(
          "jitterFraction must be within [0.0, 1.0) (current: " + jitterFraction + ")");
    }
    this.base = base;
    this.maxDelay = maxDelay;
    this.jitterFraction = jitterFraction;
    this.random = random;
  }

  /**
   * Delay before poll number {@code attempt}.
   *
   * @param attempt zero-based attempt number
   * @return a delay in {@code [0, maxDelay]}
   */
  public Duration nextDelay(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0 (current: " + attempt + ")");
    }

    long baseNanos = base.toNanos();
    long maxNanos = maxDelay.toNanos();
    // Shifting past 62 bits, or a product past maxNanos, both mean "capped"
    long exponential =
        attempt >= 62 || baseNanos > (maxNanos >> attempt) ? maxNanos : baseNanos << attempt;

    double jitter = exponential * jitterFraction * (2.0 * random.getAsDouble() - 1.0);
    long delay = Math.max(0L, Math.min(maxNanos, exponential + (long) jitter));
    return Duration.ofNanos(delay);
  }

  /** Time left until {@code deadline}, never negative. */
  public Duration remainingBudget(Instant deadline, Instant now) {
    Duration remaining = Duration.between(now, deadline);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  /**
   * Plan the next poll, or nothing if it would not fire before the deadline.
   *
   * @return the planned attempt, empty when the job should time out instead of waiting
   */
  public Optional<PollAttempt> plan(int attempt, Instant deadline, Instant now) {
    Duration delay = nextDelay(attempt);
    if (delay.compareTo(remainingBudget(deadline, now)) >= 0) {
      return Optional.empty();
    }
    return Optional.of(new PollAttempt(attempt, delay));
  }

  public Duration getBase() {
    return base;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getJitterFraction() {
    return jitterFraction;
  }
}
