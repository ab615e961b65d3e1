package com.scholary.synthjobs.api;

import com.scholary.synthjobs.error.AdmissionDeniedException;
import com.scholary.synthjobs.error.JobConfigurationException;
import com.scholary.synthjobs.error.JobNotFoundException;
import com.scholary.synthjobs.error.OrchestratorSaturatedException;
import java.time.Duration;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP responses.
 *
 * <p>Only classified, caller-safe messages go into response bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String RATE_LIMIT_MESSAGE = "Too many generation requests. Please try again later.";

  @ExceptionHandler(AdmissionDeniedException.class)
  public ResponseEntity<ErrorResponse> handleAdmissionDenied(AdmissionDeniedException e) {
    long retryAfterSeconds = toRetryAfterSeconds(e.getRetryAfter());
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
        .body(new ErrorResponse(RATE_LIMIT_MESSAGE, retryAfterSeconds));
  }

  @ExceptionHandler(JobConfigurationException.class)
  public ResponseEntity<ErrorResponse> handleConfiguration(JobConfigurationException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(OrchestratorSaturatedException.class)
  public ResponseEntity<ErrorResponse> handleSaturated(OrchestratorSaturatedException e) {
    LOGGER.warn("Service saturated: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of("Service is at capacity. Please try again later."));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid request: " + detail));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed request body"));
  }

  /** Whole seconds until retry, rounded up so a client never retries too early. */
  static long toRetryAfterSeconds(Duration retryAfter) {
    if (retryAfter == null || retryAfter.isZero() || retryAfter.isNegative()) {
      return 0;
    }
    long seconds = retryAfter.getSeconds();
    return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
  }
}
