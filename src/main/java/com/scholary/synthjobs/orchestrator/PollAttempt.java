package com.scholary.synthjobs.orchestrator;

import java.time.Duration;

/** One planned status poll: its zero-based attempt number and the delay before it fires. */
public record PollAttempt(int number, Duration delay) {}
