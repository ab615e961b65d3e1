package com.scholary.synthjobs.admission;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-process window store backed by a Caffeine cache.
 *
 * <p>Each entry expires on its own at the end of its window, driven by a ticker that reads the
 * same {@link Clock} the admission gate uses. Updates go through {@code asMap().compute}, which is
 * atomic per key, so two requests from the same caller cannot both take the last slot.
 *
 * <p>Limits are per process. Running several instances multiplies the effective budget; swap in
 * an external store to share counters across instances.
 */
public class InMemoryWindowStore implements WindowStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryWindowStore.class);

  private final Cache<String, RateLimitWindow> cache;

  public InMemoryWindowStore(Clock clock) {
    Ticker ticker = () -> toEpochNanos(clock.instant());
    this.cache =
        Caffeine.newBuilder().ticker(ticker).expireAfter(new WindowExpiry()).build();

    LOGGER.info("Initialized in-memory rate-limit window store");
  }

  @Override
  public RateLimitWindow update(String key, UnaryOperator<RateLimitWindow> updater) {
    return cache.asMap().compute(key, (k, current) -> updater.apply(current));
  }

  @Override
  public Optional<RateLimitWindow> get(String key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  @Override
  public int evictExpired(Instant now) {
    long before = cache.estimatedSize();
    for (Map.Entry<String, RateLimitWindow> entry : cache.asMap().entrySet()) {
      if (entry.getValue().isExpired(now)) {
        cache.asMap().remove(entry.getKey(), entry.getValue());
      }
    }
    cache.cleanUp();
    return (int) Math.max(0, before - cache.estimatedSize());
  }

  @Override
  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private static long toEpochNanos(Instant instant) {
    return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
  }

  /** Expires a window exactly when it resets. */
  private static final class WindowExpiry implements Expiry<String, RateLimitWindow> {

    @Override
    public long expireAfterCreate(String key, RateLimitWindow window, long currentTime) {
      return Math.max(0, toEpochNanos(window.resetsAt()) - currentTime);
    }

    @Override
    public long expireAfterUpdate(
        String key, RateLimitWindow window, long currentTime, long currentDuration) {
      return Math.max(0, toEpochNanos(window.resetsAt()) - currentTime);
    }

    @Override
    public long expireAfterRead(
        String key, RateLimitWindow window, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
