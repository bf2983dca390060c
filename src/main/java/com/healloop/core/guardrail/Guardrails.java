package com.healloop.core.guardrail;

/**
 * Hard limits for one execution. All values are strictly positive.
 *
 * @param maxAttempts        tool invocations allowed
 * @param maxDurationSeconds wall-clock budget of the attempt loop
 * @param maxPayloadChars    largest serialized outgoing payload accepted
 */
public record Guardrails(int maxAttempts, double maxDurationSeconds, int maxPayloadChars) {

    public static final String MAX_ATTEMPTS = "max_attempts";
    public static final String MAX_DURATION_SECONDS = "max_duration_seconds";
    public static final String MAX_PAYLOAD_CHARS = "max_payload_chars";

    public Guardrails {
        if (maxAttempts <= 0 || maxDurationSeconds <= 0 || maxPayloadChars <= 0) {
            throw new IllegalArgumentException("Guardrails must be positive: attempts=" + maxAttempts
                    + ", duration=" + maxDurationSeconds + ", payload=" + maxPayloadChars);
        }
    }

    public long maxDurationMillis() {
        return (long) (maxDurationSeconds * 1000);
    }
}
