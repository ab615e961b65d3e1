package com.scholary.synthjobs.admission;

import java.time.Instant;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for per-key rate-limit windows.
 *
 * <p>The admission gate only needs an atomic read-modify-write on a single key, so this can be
 * backed by a local map or by an external store that offers atomic increment-and-expire.
 */
public interface WindowStore {

  /**
   * Atomically replace the window stored under {@code key}.
   *
   * <p>The updater receives {@code null} when no live window exists for the key. Implementations
   * that retry on contention may invoke the updater more than once, so it must be free of side
   * effects other than recording its latest result.
   *
   * @param key the admission key
   * @param updater computes the next window from the current one
   * @return the window now stored under the key
   */
  RateLimitWindow update(String key, UnaryOperator<RateLimitWindow> updater);

  Optional<RateLimitWindow> get(String key);

  /**
   * Remove every window that has expired at {@code now}.
   *
   * @return the number of windows removed
   */
  int evictExpired(Instant now);

  long size();
}
