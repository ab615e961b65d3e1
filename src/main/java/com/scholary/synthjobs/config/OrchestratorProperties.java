package com.scholary.synthjobs.config;

import com.scholary.synthjobs.error.JobConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job orchestration.
 *
 * <p>Controls deadlines, retries, result retention, polling backoff and the thread pools that run
 * job tasks and provider calls.
 */
@ConfigurationProperties(prefix = "orchestrator")
@Validated
public record OrchestratorProperties(
    @NotNull Duration defaultDeadline,
    @NotNull Duration maxDeadline,
    @PositiveOrZero int maxSubmissionRetries,
    @NotNull Duration syncWait,
    @NotNull Duration retention,
    @Positive int maxTrackedJobs,
    @Valid @NotNull PollProperties poll,
    @Valid @NotNull ExecutorProperties executor) {

  public OrchestratorProperties {
    requirePositive("defaultDeadline", defaultDeadline);
    requirePositive("maxDeadline", maxDeadline);
    requirePositive("syncWait", syncWait);
    requirePositive("retention", retention);
    if (defaultDeadline.compareTo(maxDeadline) > 0) {
      throw new JobConfigurationException("defaultDeadline must not exceed maxDeadline");
    }
  }

  public record PollProperties(
      @NotNull Duration base, @NotNull Duration maxDelay, @PositiveOrZero double jitterFraction) {}

  public record ExecutorProperties(
      @Positive int jobThreads,
      @Positive int jobQueueSize,
      @Positive int schedulerThreads,
      @Positive int providerThreads) {}

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new JobConfigurationException(name + " must be positive (current: " + value + ")");
    }
  }
}
