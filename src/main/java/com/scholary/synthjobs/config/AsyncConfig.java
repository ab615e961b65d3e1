package com.scholary.synthjobs.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for async task execution.
 *
 * <p>Job steps run on a bounded pool and are short: none of them sleeps or waits on the provider.
 * Backoff delays and deadlines are timers on the job scheduler, and the blocking provider calls
 * run on a pool of their own.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public ThreadPoolTaskExecutor jobExecutor(OrchestratorProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executor().jobThreads());
    executor.setMaxPoolSize(properties.executor().jobThreads());
    executor.setQueueCapacity(properties.executor().jobQueueSize());
    executor.setThreadNamePrefix("synth-job-");
    executor.initialize();
    return executor;
  }

  /** Timers for backoff delays and job deadlines. Also runs the {@code @Scheduled} sweeps. */
  @Bean(name = "jobScheduler")
  public ThreadPoolTaskScheduler jobScheduler(OrchestratorProperties properties, Clock clock) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.executor().schedulerThreads());
    scheduler.setClock(clock);
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setThreadNamePrefix("synth-timer-");
    scheduler.initialize();
    return scheduler;
  }

  @Bean(name = "providerExecutor")
  public ThreadPoolTaskExecutor providerExecutor(OrchestratorProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executor().providerThreads());
    executor.setMaxPoolSize(properties.executor().providerThreads());
    executor.setThreadNamePrefix("provider-io-");
    executor.initialize();
    return executor;
  }
}
