package com.scholary.synthjobs.admission;

import com.scholary.synthjobs.config.AdmissionProperties;
import com.scholary.synthjobs.error.JobConfigurationException;
import com.scholary.synthjobs.logging.StructuredLogger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed-window rate limiter consulted before every expensive call.
 *
 * <p>For each admission key the gate keeps one {@link RateLimitWindow}. A request is admitted
 * when {@code count + cost <= limit} in the live window; otherwise it is denied with the time
 * left until the window resets. An expired or missing window is replaced by a fresh one before
 * the check, so a key that has never been seen is always admitted on its first call.
 *
 * <p>Fixed windows can let up to twice the limit through around a window boundary. That is
 * accepted here: the gate bounds cost exposure, it does not promise fairness.
 */
@Component
public class AdmissionGate {

  private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionGate.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final WindowStore windowStore;
  private final Map<String, OperationClassLimit> classLimits;
  private final String defaultClass;
  private final Clock clock;

  @Autowired
  public AdmissionGate(WindowStore windowStore, AdmissionProperties properties, Clock clock) {
    this(windowStore, properties.classes(), properties.defaultClass(), clock);
  }

  public AdmissionGate(
      WindowStore windowStore,
      Map<String, OperationClassLimit> classLimits,
      String defaultClass,
      Clock clock) {
    this.windowStore = windowStore;
    this.classLimits = Map.copyOf(classLimits);
    this.defaultClass = defaultClass;
    this.clock = clock;

    LOGGER.info(
        "Initialized admission gate: classes={}, defaultClass={}",
        this.classLimits.keySet(),
        defaultClass);
  }

  /**
   * Check admission using the configured cost of the key's operation class.
   *
   * @param key the caller and operation class
   * @return the decision
   * @throws JobConfigurationException if the class is unknown or its cost exceeds its limit
   */
  public AdmissionDecision tryAdmit(AdmissionKey key) {
    return tryAdmit(key, limitFor(key.operationClass()).cost());
  }

  /**
   * Check admission for a weighted request.
   *
   * <p>A cost above the class limit could never be admitted, so it is reported as a
   * configuration error rather than as an ordinary denial.
   *
   * @param key the caller and operation class
   * @param cost how many budget units this request consumes
   * @return {@link AdmissionDecision#allowed()} or a denial carrying {@code retryAfter}
   * @throws JobConfigurationException if the cost is not positive or exceeds the class limit
   */
  public AdmissionDecision tryAdmit(AdmissionKey key, int cost) {
    OperationClassLimit classLimit = limitFor(key.operationClass());
    if (cost <= 0) {
      throw new JobConfigurationException("cost must be positive (current: " + cost + ")");
    }
    if (cost > classLimit.limit()) {
      throw new JobConfigurationException(
          String.format(
              "cost %d exceeds limit %d for operation class %s",
              cost, classLimit.limit(), key.operationClass()));
    }

    Instant now = clock.instant();
    AtomicReference<AdmissionDecision> decision = new AtomicReference<>();

    windowStore.update(
        key.value(),
        current -> {
          RateLimitWindow window =
              current == null || current.isExpired(now)
                  ? RateLimitWindow.open(now, classLimit)
                  : current;
          if (window.canAdmit(cost)) {
            RateLimitWindow admitted = window.admit(cost);
            decision.set(AdmissionDecision.allowed(admitted));
            return admitted;
          }
          decision.set(AdmissionDecision.denied(window, now));
          return window;
        });

    AdmissionDecision result = decision.get();
    if (result.denied()) {
      structuredLogger.logAdmissionDenied(key.value(), cost, result.retryAfter());
    } else {
      LOGGER.debug(
          "Admitted: key={}, cost={}, remaining={}", key.value(), cost, result.remaining());
    }
    return result;
  }

  /**
   * Resolve the budget for an operation class, falling back to the default class if one is
   * configured.
   *
   * @throws JobConfigurationException if neither the class nor a default is configured
   */
  public OperationClassLimit limitFor(String operationClass) {
    OperationClassLimit limit = classLimits.get(operationClass);
    if (limit == null && defaultClass != null) {
      limit = classLimits.get(defaultClass);
    }
    if (limit == null) {
      throw new JobConfigurationException("Unknown operation class: " + operationClass);
    }
    return limit;
  }
}
