package com.healloop.core.guardrail;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * System-wide guardrail defaults. A contract may tighten or loosen them through its
 * {@code execution_constraints}.
 */
@Component
@ConfigurationProperties(prefix = "healloop.guardrails")
public class GuardrailProperties {

    private int maxAttempts = 3;
    private double maxDurationSeconds = 240;
    private int maxPayloadChars = 12000;
    /** Pause between attempts. Zero retries immediately. */
    private long backoffMillis = 0;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public double getMaxDurationSeconds() {
        return maxDurationSeconds;
    }

    public void setMaxDurationSeconds(double maxDurationSeconds) {
        this.maxDurationSeconds = maxDurationSeconds;
    }

    public int getMaxPayloadChars() {
        return maxPayloadChars;
    }

    public void setMaxPayloadChars(int maxPayloadChars) {
        this.maxPayloadChars = maxPayloadChars;
    }

    public long getBackoffMillis() {
        return backoffMillis;
    }

    public void setBackoffMillis(long backoffMillis) {
        this.backoffMillis = backoffMillis;
    }
}
