package com.scholary.synthjobs.admission;

import com.scholary.synthjobs.error.JobConfigurationException;
import java.time.Duration;

/**
 * Budget for one operation class: at most {@code limit} cost units per {@code window}. Each
 * admission of the class consumes {@code cost} units unless the caller asks for another weight.
 */
public record OperationClassLimit(int limit, Duration window, Integer cost) {

  public OperationClassLimit {
    if (cost == null) {
      cost = 1;
    }
    if (limit <= 0) {
      throw new JobConfigurationException("limit must be positive (current: " + limit + ")");
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new JobConfigurationException("window must be positive (current: " + window + ")");
    }
    if (cost <= 0 || cost > limit) {
      throw new JobConfigurationException(
          "cost must be within [1, limit] (cost: " + cost + ", limit: " + limit + ")");
    }
  }

  public static OperationClassLimit of(int limit, Duration window) {
    return new OperationClassLimit(limit, window, 1);
  }
}
