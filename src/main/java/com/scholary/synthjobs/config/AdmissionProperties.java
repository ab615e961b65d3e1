package com.scholary.synthjobs.config;

import com.scholary.synthjobs.admission.OperationClassLimit;
import com.scholary.synthjobs.error.JobConfigurationException;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the admission gate.
 *
 * <p>One {@link OperationClassLimit} per operation class. Requests for a class that is not listed
 * fall back to {@code defaultClass} when it is set, and are rejected otherwise.
 */
@ConfigurationProperties(prefix = "admission")
@Validated
public record AdmissionProperties(
    Duration sweepInterval,
    String defaultClass,
    @NotEmpty Map<String, OperationClassLimit> classes) {

  public AdmissionProperties {
    if (sweepInterval == null) {
      sweepInterval = Duration.ofMinutes(1);
    }
    if (classes == null) {
      classes = Map.of();
    }
    if (defaultClass != null && !classes.containsKey(defaultClass)) {
      throw new JobConfigurationException(
          "defaultClass " + defaultClass + " is not a configured operation class");
    }
  }
}
