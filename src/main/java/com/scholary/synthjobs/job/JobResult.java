package com.scholary.synthjobs.job;

import com.fasterxml.jackson.databind.JsonNode;

/** Opaque provider output of a succeeded job. */
public record JobResult(JsonNode output) {}
