package com.healloop.core.knowledge;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A known fix for an error pattern, with how often applying it has worked.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ErrorSolution(
    String pattern,
    String solution,
    Double successRate,
    Map<String, Object> metadata,
    Instant updatedAt
) {
    /** Rate assumed for an entry that does not carry one. */
    public static final double DEFAULT_SUCCESS_RATE = 0.5;

    public ErrorSolution {
        successRate = successRate == null ? DEFAULT_SUCCESS_RATE : successRate;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ErrorSolution withSuccessRate(double rate) {
        return new ErrorSolution(pattern, solution, rate, metadata, Instant.now());
    }
}
