package com.healloop.core.memory;

import java.time.Instant;

/**
 * A proactive "future enhancement" idea captured after a slow or complex success.
 * Stored for later human review and never applied automatically.
 */
public record Recommendation(
    Instant timestamp,
    String request,
    String tool,
    String reason,
    String suggestion
) {}
