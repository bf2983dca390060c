package com.healloop.core.guardrail;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Attempt budget, optional backoff, deadline and cancellation for one execution.
 * The clock starts when the policy is created.
 */
public class RetryPolicy {

    private final Guardrails guardrails;
    private final long backoffMillis;
    private final CancellationToken cancellation;
    private final LongSupplier clock;
    private final long startedAt;

    public RetryPolicy(Guardrails guardrails, long backoffMillis, CancellationToken cancellation) {
        this(guardrails, backoffMillis, cancellation, System::currentTimeMillis);
    }

    RetryPolicy(Guardrails guardrails, long backoffMillis, CancellationToken cancellation, LongSupplier clock) {
        this.guardrails = guardrails;
        this.backoffMillis = Math.max(0, backoffMillis);
        this.cancellation = cancellation == null ? CancellationToken.none() : cancellation;
        this.clock = clock;
        this.startedAt = clock.getAsLong();
    }

    public int maxAttempts() {
        return guardrails.maxAttempts();
    }

    public boolean isLastAttempt(int attempt) {
        return attempt >= guardrails.maxAttempts();
    }

    public long elapsedMillis() {
        return clock.getAsLong() - startedAt;
    }

    public boolean deadlineExceeded() {
        return elapsedMillis() > guardrails.maxDurationMillis();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Waits out the backoff before the next attempt. Returns false when interrupted, in
     * which case the interrupt flag is restored and no further attempt should run.
     */
    public boolean pause() {
        if (backoffMillis == 0) {
            return true;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(backoffMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
