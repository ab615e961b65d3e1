package com.scholary.synthjobs.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request to run a job.
 *
 * @param operationClass selects the rate-limit budget, e.g. {@code audio-gen}
 * @param payload provider input, passed through untouched
 * @param deadlineSeconds optional total time budget; the configured default applies when absent
 */
public record JobRequest(
    @NotBlank String operationClass,
    @NotNull JsonNode payload,
    @Positive Integer deadlineSeconds) {}
