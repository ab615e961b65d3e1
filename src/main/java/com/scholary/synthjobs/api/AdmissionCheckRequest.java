package com.scholary.synthjobs.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/** Standalone admission check; {@code cost} defaults to the operation class's configured cost. */
public record AdmissionCheckRequest(@NotBlank String operationClass, @Positive Integer cost) {}
