package com.healloop.core.telemetry;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Aggregate over a set of {@link TelemetryRecord}s.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TelemetrySummary(
    int attempts,
    long totalDurationMs,
    int successCount,
    int errorCount,
    int exceptionCount,
    long averageDurationMs
) {
    public static final TelemetrySummary EMPTY = new TelemetrySummary(0, 0, 0, 0, 0, 0);

    public static TelemetrySummary of(List<TelemetryRecord> records) {
        if (records == null || records.isEmpty()) {
            return EMPTY;
        }
        long total = 0;
        int success = 0;
        int errors = 0;
        int exceptions = 0;
        for (TelemetryRecord record : records) {
            total += record.durationMs();
            switch (record.status()) {
                case SUCCESS -> success++;
                case ERROR -> errors++;
                case EXCEPTION -> exceptions++;
            }
        }
        return new TelemetrySummary(records.size(), total, success, errors, exceptions, total / records.size());
    }

    /** Attempts that did not succeed, whether reported or thrown. */
    public int failureCount() {
        return errorCount + exceptionCount;
    }
}
