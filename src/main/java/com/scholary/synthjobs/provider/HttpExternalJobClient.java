package com.scholary.synthjobs.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.synthjobs.job.JobPayload;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a queue-style generation provider.
 *
 * <p>Wire format:
 *
 * <pre>
 * POST {baseUrl}{submitPath}        {"input": &lt;payload&gt;}
 * GET  {baseUrl}{statusPath}
 * POST {baseUrl}{cancelPath}
 *
 * response: {"id": "...", "status": "...", "output": ..., "error": "..."}
 * </pre>
 *
 * <p>Each method makes exactly one attempt. Connection failures, timeouts, 408, 425, 429 and 5xx
 * responses become {@link TransientProviderException}; any other non-2xx response becomes {@link
 * PermanentProviderException}.
 */
@Component
public class HttpExternalJobClient implements ExternalJobClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpExternalJobClient.class);

  private final HttpClient httpClient;
  private final ProviderProperties properties;
  private final ObjectMapper objectMapper;

  public HttpExternalJobClient(ProviderProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized provider client: baseUrl={}, cancelSupported={}",
        properties.baseUrl(),
        properties.cancelSupported());
  }

  @Override
  public SubmitResult submit(JobPayload payload) {
    ObjectNode body = objectMapper.createObjectNode();
    body.set("input", payload.body());

    HttpRequest request =
        requestBuilder(properties.submitPath())
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(writeJson(body)))
            .build();

    JsonNode response = send(request);
    String id = textOrNull(response, "id");
    ProviderState state = ProviderState.fromLabel(textOrNull(response, "status"));

    if (state == ProviderState.FAILED) {
      throw new PermanentProviderException(
          "Provider rejected job: " + textOrNull(response, "error"));
    }
    if (state == ProviderState.SUCCEEDED && hasOutput(response)) {
      LOGGER.info("Provider completed job synchronously: externalRef={}", id);
      return SubmitResult.completed(id, response.get("output"));
    }
    if (id == null) {
      throw new PermanentProviderException("Provider accepted job without returning an id");
    }

    LOGGER.info("Submitted job to provider: externalRef={}", id);
    return SubmitResult.accepted(id);
  }

  @Override
  public ProviderStatus status(String externalRef) {
    HttpRequest request =
        requestBuilder(expand(properties.statusPath(), externalRef)).GET().build();

    JsonNode response = send(request);
    ProviderState state = ProviderState.fromLabel(textOrNull(response, "status"));

    LOGGER.debug("Provider status: externalRef={}, state={}", externalRef, state);
    return switch (state) {
      case SUCCEEDED -> ProviderStatus.succeeded(response.get("output"));
      case FAILED -> ProviderStatus.failed(textOrNull(response, "error"));
      case RUNNING -> ProviderStatus.running();
    };
  }

  @Override
  public boolean supportsCancel() {
    return properties.cancelSupported();
  }

  @Override
  public boolean cancel(String externalRef) {
    if (!supportsCancel()) {
      return false;
    }
    HttpRequest request =
        requestBuilder(expand(properties.cancelPath(), externalRef))
            .POST(BodyPublishers.noBody())
            .build();
    try {
      send(request);
      LOGGER.info("Provider acknowledged cancellation: externalRef={}", externalRef);
      return true;
    } catch (ProviderException e) {
      LOGGER.warn(
          "Provider cancellation failed: externalRef={}, error={}", externalRef, e.getMessage());
      return false;
    }
  }

  private HttpRequest.Builder requestBuilder(String path) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + path))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Accept", "application/json");
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    return builder;
  }

  /**
   * Send a request and parse the JSON body, classifying every failure.
   *
   * @throws TransientProviderException if the call may succeed on retry
   * @throws PermanentProviderException if it will not
   */
  private JsonNode send(HttpRequest request) {
    LOGGER.debug("Sending {} {}", request.method(), request.uri());

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TransientProviderException(
          String.format("%s %s failed: %s", request.method(), request.uri(), e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientProviderException("Provider call interrupted", e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      String detail = String.format("Provider returned status %d: %s", status, response.body());
      if (isRetryable(status)) {
        throw new TransientProviderException(detail);
      }
      throw new PermanentProviderException(detail);
    }

    String body = response.body();
    if (body == null || body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new TransientProviderException("Provider returned malformed JSON", e);
    }
  }

  static boolean isRetryable(int status) {
    return status == 408 || status == 425 || status == 429 || status >= 500;
  }

  private String writeJson(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new PermanentProviderException("Payload could not be serialized", e);
    }
  }

  private static String expand(String path, String externalRef) {
    return path.replace("{id}", URLEncoder.encode(externalRef, StandardCharsets.UTF_8));
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static boolean hasOutput(JsonNode node) {
    JsonNode output = node.get("output");
    return output != null && !output.isNull();
  }
}
