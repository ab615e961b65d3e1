package com.scholary.synthjobs.admission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.synthjobs.error.JobConfigurationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class OperationClassLimitTest {

  @Test
  void constructor_shouldDefaultCostToOne() {
    OperationClassLimit limit = new OperationClassLimit(10, Duration.ofMinutes(1), null);

    assertThat(limit.cost()).isEqualTo(1);
  }

  @Test
  void constructor_shouldRejectNonPositiveLimit() {
    assertThatThrownBy(() -> OperationClassLimit.of(0, Duration.ofMinutes(1)))
        .isInstanceOf(JobConfigurationException.class)
        .hasMessageContaining("limit");
  }

  @Test
  void constructor_shouldRejectNonPositiveWindow() {
    assertThatThrownBy(() -> OperationClassLimit.of(5, Duration.ZERO))
        .isInstanceOf(JobConfigurationException.class)
        .hasMessageContaining("window");
  }

  @Test
  void constructor_shouldRejectCostAboveLimit() {
    assertThatThrownBy(() -> new OperationClassLimit(5, Duration.ofMinutes(1), 6))
        .isInstanceOf(JobConfigurationException.class)
        .hasMessageContaining("cost");
  }
}
