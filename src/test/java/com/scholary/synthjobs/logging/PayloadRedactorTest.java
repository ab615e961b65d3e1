package com.scholary.synthjobs.logging;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class PayloadRedactorTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void redact_shouldMaskSensitiveFieldsAtAnyDepth() throws Exception {
    JsonNode payload =
        objectMapper.readTree(
            "{\"prompt\":\"lofi beat\",\"apiKey\":\"sk-123\","
                + "\"owner\":{\"email\":\"a@b.c\",\"plan\":\"pro\"},"
                + "\"tracks\":[{\"access_token\":\"t\",\"title\":\"intro\"}]}");

    JsonNode redacted = PayloadRedactor.redact(payload);

    assertThat(redacted.get("prompt").asText()).isEqualTo("lofi beat");
    assertThat(redacted.get("apiKey").asText()).isEqualTo(PayloadRedactor.REDACTED);
    assertThat(redacted.at("/owner/email").asText()).isEqualTo(PayloadRedactor.REDACTED);
    assertThat(redacted.at("/owner/plan").asText()).isEqualTo("pro");
    assertThat(redacted.at("/tracks/0/access_token").asText()).isEqualTo(PayloadRedactor.REDACTED);
    assertThat(redacted.at("/tracks/0/title").asText()).isEqualTo("intro");
  }

  @Test
  void redact_shouldLeaveInputUntouched() throws Exception {
    JsonNode payload = objectMapper.readTree("{\"password\":\"hunter2\"}");

    PayloadRedactor.redact(payload);

    assertThat(payload.get("password").asText()).isEqualTo("hunter2");
  }

  @Test
  void isSensitive_shouldMatchCommonVariants() {
    assertThat(PayloadRedactor.isSensitive("Authorization")).isTrue();
    assertThat(PayloadRedactor.isSensitive("api-key")).isTrue();
    assertThat(PayloadRedactor.isSensitive("first_name")).isTrue();
    assertThat(PayloadRedactor.isSensitive("creditCardNumber")).isTrue();
    assertThat(PayloadRedactor.isSensitive("duration")).isFalse();
  }
}
