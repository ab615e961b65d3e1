package com.scholary.synthjobs.admission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.synthjobs.MutableClock;
import com.scholary.synthjobs.error.JobConfigurationException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AdmissionGateTest {

  private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

  private MutableClock clock;
  private AdmissionGate gate;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    gate =
        new AdmissionGate(
            new InMemoryWindowStore(clock),
            Map.of(
                "audio-gen", OperationClassLimit.of(3, Duration.ofSeconds(60)),
                "heavy", new OperationClassLimit(10, Duration.ofSeconds(60), 4),
                "default", OperationClassLimit.of(100, Duration.ofMinutes(15))),
            "default",
            clock);
  }

  @Test
  void tryAdmit_shouldAllowUpToLimitThenDeny() {
    AdmissionKey key = AdmissionKey.of("user:1", "audio-gen");

    assertThat(gate.tryAdmit(key).allowed()).isTrue();
    assertThat(gate.tryAdmit(key).allowed()).isTrue();
    assertThat(gate.tryAdmit(key).allowed()).isTrue();

    AdmissionDecision denied = gate.tryAdmit(key);
    assertThat(denied.allowed()).isFalse();
    assertThat(denied.retryAfter()).isPositive();
    assertThat(denied.remaining()).isZero();
  }

  @Test
  void tryAdmit_shouldReportRetryAfterUntilWindowReset() {
    AdmissionKey key = AdmissionKey.of("user:1", "audio-gen");

    assertThat(gate.tryAdmit(key).allowed()).isTrue();
    clock.advance(Duration.ofSeconds(1));
    assertThat(gate.tryAdmit(key).allowed()).isTrue();
    clock.advance(Duration.ofSeconds(1));
    assertThat(gate.tryAdmit(key).allowed()).isTrue();
    clock.advance(Duration.ofSeconds(1));

    AdmissionDecision denied = gate.tryAdmit(key);
    assertThat(denied.allowed()).isFalse();
    assertThat(denied.retryAfter()).isEqualTo(Duration.ofSeconds(57));

    clock.set(START.plusSeconds(61));
    AdmissionDecision afterReset = gate.tryAdmit(key);
    assertThat(afterReset.allowed()).isTrue();
    assertThat(afterReset.remaining()).isEqualTo(2);
  }

  @Test
  void tryAdmit_shouldKeepCallersIndependent() {
    AdmissionKey first = AdmissionKey.of("user:1", "audio-gen");
    AdmissionKey second = AdmissionKey.of("user:2", "audio-gen");

    for (int i = 0; i < 3; i++) {
      gate.tryAdmit(first);
    }

    assertThat(gate.tryAdmit(first).allowed()).isFalse();
    assertThat(gate.tryAdmit(second).allowed()).isTrue();
  }

  @Test
  void tryAdmit_shouldKeepOperationClassesIndependent() {
    AdmissionKey audio = AdmissionKey.of("user:1", "audio-gen");
    for (int i = 0; i < 3; i++) {
      gate.tryAdmit(audio);
    }

    assertThat(gate.tryAdmit(AdmissionKey.of("user:1", "heavy")).allowed()).isTrue();
  }

  @Test
  void tryAdmit_shouldChargeConfiguredClassCost() {
    AdmissionKey key = AdmissionKey.of("user:1", "heavy");

    assertThat(gate.tryAdmit(key).remaining()).isEqualTo(6);
    assertThat(gate.tryAdmit(key).remaining()).isEqualTo(2);
    assertThat(gate.tryAdmit(key).allowed()).isFalse();
  }

  @Test
  void tryAdmit_shouldAdmitSmallerCostWhenLargerDoesNotFit() {
    AdmissionKey key = AdmissionKey.of("user:1", "heavy");
    gate.tryAdmit(key, 8);

    assertThat(gate.tryAdmit(key, 3).allowed()).isFalse();
    assertThat(gate.tryAdmit(key, 2).allowed()).isTrue();
  }

  @Test
  void tryAdmit_shouldRejectCostAboveLimitAsConfigurationError() {
    AdmissionKey key = AdmissionKey.of("user:1", "audio-gen");

    assertThatThrownBy(() -> gate.tryAdmit(key, 4))
        .isInstanceOf(JobConfigurationException.class)
        .hasMessageContaining("exceeds limit");
  }

  @Test
  void tryAdmit_shouldRejectNonPositiveCost() {
    AdmissionKey key = AdmissionKey.of("user:1", "audio-gen");

    assertThatThrownBy(() -> gate.tryAdmit(key, 0)).isInstanceOf(JobConfigurationException.class);
  }

  @Test
  void tryAdmit_shouldFallBackToDefaultClass() {
    AdmissionDecision decision = gate.tryAdmit(AdmissionKey.of("user:1", "lyrics-gen"));

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.remaining()).isEqualTo(99);
  }

  @Test
  void tryAdmit_shouldRejectUnknownClassWithoutDefault() {
    AdmissionGate strict =
        new AdmissionGate(
            new InMemoryWindowStore(clock),
            Map.of("audio-gen", OperationClassLimit.of(3, Duration.ofSeconds(60))),
            null,
            clock);

    assertThatThrownBy(() -> strict.tryAdmit(AdmissionKey.of("user:1", "lyrics-gen")))
        .isInstanceOf(JobConfigurationException.class)
        .hasMessageContaining("Unknown operation class");
  }

  @Test
  void tryAdmit_shouldAdmitExactlyLimitUnderConcurrency() throws Exception {
    AdmissionGate wide =
        new AdmissionGate(
            new InMemoryWindowStore(clock),
            Map.of("audio-gen", OperationClassLimit.of(20, Duration.ofSeconds(60))),
            null,
            clock);
    AdmissionKey key = AdmissionKey.of("user:1", "audio-gen");

    int callers = 64;
    ExecutorService executor = Executors.newFixedThreadPool(16);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        Callable<Boolean> call =
            () -> {
              start.await();
              return wide.tryAdmit(key).allowed();
            };
        results.add(executor.submit(call));
      }
      start.countDown();

      int allowed = 0;
      for (Future<Boolean> result : results) {
        if (result.get()) {
          allowed++;
        }
      }
      assertThat(allowed).isEqualTo(20);
    } finally {
      executor.shutdownNow();
    }
  }
}
