package com.healloop.core.telemetry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Outcome metrics for one tool attempt.
 *
 * @param executionId execution the attempt belongs to
 * @param timestamp   when the attempt finished
 * @param tool        tool invoked
 * @param attempt     1-based attempt index
 * @param durationMs  wall-clock duration of the callback
 * @param status      reported or inferred outcome
 * @param error       error text, null on success
 * @param payloadSize serialized size of the outgoing payload in characters
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelemetryRecord(
    String executionId,
    Instant timestamp,
    String tool,
    int attempt,
    long durationMs,
    TelemetryStatus status,
    String error,
    int payloadSize
) {
    boolean failed() {
        return status != TelemetryStatus.SUCCESS;
    }
}
