package com.scholary.synthjobs.admission;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically drops expired windows so idle keys do not accumulate. */
@Component
public class WindowSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(WindowSweeper.class);

  private final WindowStore windowStore;
  private final Clock clock;

  public WindowSweeper(WindowStore windowStore, Clock clock) {
    this.windowStore = windowStore;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${admission.sweepInterval:PT60S}",
      initialDelayString = "${admission.sweepInterval:PT60S}")
  public void sweep() {
    int evicted = windowStore.evictExpired(clock.instant());
    if (evicted > 0) {
      LOGGER.debug("Swept {} expired rate-limit windows, {} live", evicted, windowStore.size());
    }
  }
}
