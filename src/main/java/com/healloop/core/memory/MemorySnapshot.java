package com.healloop.core.memory;

import java.time.Instant;

/**
 * Advisory record of one finished execution, fed back to the planner as context.
 *
 * @param timestamp       when the execution finished
 * @param request         the user request that triggered the execution
 * @param tool            tool that was invoked
 * @param status          final envelope status ("success", "error", ...)
 * @param resultExcerpt   result or error text, truncated
 * @param intent          the contract's intent
 * @param attempts        attempts made
 * @param durationMs      total wall-clock duration of the attempt loop
 * @param notes           free-form notes (guardrail breaches, fallback contract, ...)
 */
public record MemorySnapshot(
    Instant timestamp,
    String request,
    String tool,
    String status,
    String resultExcerpt,
    String intent,
    int attempts,
    long durationMs,
    String notes
) {
    /** Maximum length of {@link #resultExcerpt}. */
    public static final int EXCERPT_CHARS = 500;

    public static String excerpt(Object value) {
        if (value == null) return "";
        String text = String.valueOf(value);
        return text.length() <= EXCERPT_CHARS ? text : text.substring(0, EXCERPT_CHARS) + "...";
    }

    /** One-line form used inside planner prompts. */
    public String toPromptLine() {
        return String.format("- [%s] %s -> %s after %d attempt(s): %s",
                tool, request, status, attempts, notes == null || notes.isBlank() ? intent : notes);
    }
}
