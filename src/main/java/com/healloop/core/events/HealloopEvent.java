package com.healloop.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a tool execution runs.
 *
 * @param eventType   event type (e.g. "execution.started", "execution.attempt", "proposal.registered")
 * @param executionId the execution this event belongs to
 * @param tool        the tool being executed
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record HealloopEvent(
    String eventType,
    String executionId,
    String tool,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String EXECUTION_STARTED = "execution.started";
    public static final String EXECUTION_ATTEMPT = "execution.attempt";
    public static final String EXECUTION_COMPLETED = "execution.completed";
    public static final String PROPOSAL_REGISTERED = "proposal.registered";
    public static final String PROPOSAL_AUTO_APPLIED = "proposal.auto_applied";

    public static HealloopEvent of(String eventType, String executionId, String tool, Map<String, Object> payload) {
        return new HealloopEvent(eventType, executionId, tool, payload, Instant.now());
    }
}
