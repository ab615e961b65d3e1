package com.scholary.synthjobs.provider;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the HTTP provider.
 *
 * <p>Paths may contain an {@code {id}} placeholder for the provider's job handle.
 */
@ConfigurationProperties(prefix = "provider")
@Validated
public record ProviderProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotBlank String submitPath,
    @NotBlank String statusPath,
    String cancelPath) {

  public boolean cancelSupported() {
    return cancelPath != null && !cancelPath.isBlank();
  }
}
