package com.healloop.core.telemetry;

import com.healloop.core.memory.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Append-only, capped history of attempt outcomes shared by all executions.
 */
public class TelemetryRecorder {

    private static final Logger log = LoggerFactory.getLogger(TelemetryRecorder.class);

    private final BoundedHistory<TelemetryRecord> records;

    public TelemetryRecorder(int capacity) {
        this.records = new BoundedHistory<>(capacity);
    }

    public TelemetryRecord record(String executionId, String tool, int attempt, long durationMs,
                                  TelemetryStatus status, String error, int payloadSize) {
        var record = new TelemetryRecord(executionId, Instant.now(), tool, attempt, durationMs,
                status, error, payloadSize);
        records.append(record);
        log.debug("Attempt {} of {} recorded: {} in {}ms", attempt, tool, status.wireValue(), durationMs);
        return record;
    }

    /** Newest {@code limit} records, oldest first. */
    public List<TelemetryRecord> recent(int limit) {
        return records.latest(limit);
    }

    /** Attempts recorded for {@code tool} still held in the buffer. */
    public long attemptsFor(String tool) {
        return records.count(r -> r.tool().equals(tool));
    }

    public TelemetrySummary summary() {
        return TelemetrySummary.of(records.snapshot());
    }

    public int size() {
        return records.size();
    }

    public int capacity() {
        return records.capacity();
    }
}
