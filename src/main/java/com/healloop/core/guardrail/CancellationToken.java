package com.healloop.core.guardrail;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked between attempts. An attempt already in flight
 * is never interrupted.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
