package com.scholary.synthjobs.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Error body returned by every failed request. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, Long retryAfterSeconds) {

  public static ErrorResponse of(String message) {
    return new ErrorResponse(message, null);
  }
}
