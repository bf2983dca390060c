package com.healloop.core.learning;

/**
 * Diagnosis of a single failed attempt. Ephemeral: it informs the retry decision and the
 * patch prompt, then is discarded.
 *
 * @param rootCause       what caused the failure
 * @param fixType         kind of fix recommended
 * @param suggestedFix    description (or code) of the fix
 * @param prevention      how to avoid the failure in future
 * @param recurrenceCount how many times this (tool, error) pair has now been seen
 */
public record FailureAnalysis(
    String rootCause,
    FixType fixType,
    String suggestedFix,
    String prevention,
    int recurrenceCount
) {
    public static FailureAnalysis unavailable(int recurrenceCount) {
        return new FailureAnalysis("Unknown", FixType.UNKNOWN,
                "Manual investigation required", "Monitor for recurrence", recurrenceCount);
    }

    public boolean recurring() {
        return recurrenceCount > 1;
    }
}
