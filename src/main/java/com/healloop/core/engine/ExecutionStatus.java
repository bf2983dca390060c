package com.healloop.core.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Envelope status of a finished execution.
 */
public enum ExecutionStatus {
    SUCCESS,
    /** Failed; a patch proposal waits for review. */
    PENDING_APPROVAL,
    /** Failed; a patch proposal was applied by the auto-fix gate. */
    AUTO_APPLIED,
    ERROR,
    /** Required fields missing or parameters rejected; no attempt was made. */
    VALIDATION_ERROR;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
