package com.scholary.synthjobs.config;

import com.scholary.synthjobs.admission.InMemoryWindowStore;
import com.scholary.synthjobs.admission.WindowStore;
import com.scholary.synthjobs.orchestrator.PollScheduler;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for admission and orchestration beans.
 *
 * <p>Every time decision reads the same {@link Clock}, so tests can substitute a controllable one.
 */
@Configuration
@EnableConfigurationProperties({OrchestratorProperties.class, AdmissionProperties.class})
public class OrchestratorConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public WindowStore windowStore(Clock clock) {
    return new InMemoryWindowStore(clock);
  }

  @Bean
  public PollScheduler pollScheduler(OrchestratorProperties properties) {
    OrchestratorProperties.PollProperties poll = properties.poll();
    return new PollScheduler(poll.base(), poll.maxDelay(), poll.jitterFraction());
  }
}
