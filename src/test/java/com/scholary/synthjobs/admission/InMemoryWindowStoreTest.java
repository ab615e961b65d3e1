package com.scholary.synthjobs.admission;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.synthjobs.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryWindowStoreTest {

  private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

  private MutableClock clock;
  private InMemoryWindowStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemoryWindowStore(clock);
  }

  @Test
  void update_shouldPassNullForUnknownKey() {
    RateLimitWindow stored =
        store.update(
            "user:1:audio-gen",
            current -> {
              assertThat(current).isNull();
              return RateLimitWindow.open(clock.instant(), limit(60)).admit(1);
            });

    assertThat(stored.count()).isEqualTo(1);
    assertThat(store.get("user:1:audio-gen")).contains(stored);
  }

  @Test
  void get_shouldHideWindowAfterItResets() {
    store.update("user:1:audio-gen", current -> RateLimitWindow.open(clock.instant(), limit(60)));

    clock.advance(Duration.ofSeconds(60));

    assertThat(store.get("user:1:audio-gen")).isEmpty();
  }

  @Test
  void evictExpired_shouldRemoveOnlyElapsedWindows() {
    store.update("user:1:short", current -> RateLimitWindow.open(clock.instant(), limit(10)));
    store.update("user:1:long", current -> RateLimitWindow.open(clock.instant(), limit(600)));

    clock.advance(Duration.ofSeconds(30));
    store.evictExpired(clock.instant());

    assertThat(store.get("user:1:short")).isEmpty();
    assertThat(store.get("user:1:long")).isPresent();
    assertThat(store.size()).isEqualTo(1);
  }

  private static OperationClassLimit limit(int windowSeconds) {
    return OperationClassLimit.of(5, Duration.ofSeconds(windowSeconds));
  }
}
