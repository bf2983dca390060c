package com.healloop.core.learning;

import java.time.Instant;

/**
 * One observed (tool, error) failure, kept for recurrence counting.
 */
public record FailurePattern(
    Instant timestamp,
    String tool,
    String error,
    int attempt
) {}
