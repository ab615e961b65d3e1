package com.scholary.synthjobs.api;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ApiExceptionHandlerTest {

  @Test
  void toRetryAfterSeconds_shouldRoundUpPartialSeconds() {
    assertThat(ApiExceptionHandler.toRetryAfterSeconds(Duration.ofSeconds(57))).isEqualTo(57);
    assertThat(ApiExceptionHandler.toRetryAfterSeconds(Duration.ofMillis(57_001))).isEqualTo(58);
    assertThat(ApiExceptionHandler.toRetryAfterSeconds(Duration.ofMillis(1))).isEqualTo(1);
  }

  @Test
  void toRetryAfterSeconds_shouldBeZeroWhenNothingToWaitFor() {
    assertThat(ApiExceptionHandler.toRetryAfterSeconds(Duration.ZERO)).isZero();
    assertThat(ApiExceptionHandler.toRetryAfterSeconds(null)).isZero();
  }
}
