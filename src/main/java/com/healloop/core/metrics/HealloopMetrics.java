package com.healloop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for tool executions and the fix pipeline.
 */
@Service
public class HealloopMetrics {

    private final MeterRegistry registry;

    public HealloopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAttempt(String tool, String status, long ms) {
        Timer.builder("healloop.attempt.duration")
                .tag("tool", tool)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordExecutionResult(String tool, String status) {
        Counter.builder("healloop.executions.total")
                .tag("tool", tool)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAttemptsPerExecution(int attempts) {
        DistributionSummary.builder("healloop.execution.attempts")
                .register(registry)
                .record(attempts);
    }

    /**
     * @param guardrail "max_duration_seconds" or "max_payload_chars"
     */
    public void recordGuardrailBreach(String guardrail) {
        Counter.builder("healloop.guardrail.breaches")
                .description("Executions stopped by a guardrail")
                .tag("guardrail", guardrail)
                .register(registry)
                .increment();
    }

    public void recordContractFallback(String tool) {
        Counter.builder("healloop.contract.fallbacks")
                .description("Contracts replaced by the deterministic fallback")
                .tag("tool", tool)
                .register(registry)
                .increment();
    }

    public void recordProposal(String riskLevel) {
        Counter.builder("healloop.proposals.registered")
                .tag("risk", riskLevel)
                .register(registry)
                .increment();
    }

    /**
     * @param decision "queued", "applied", "auto_applied" or "failed"
     */
    public void recordAutoFixDecision(String decision) {
        Counter.builder("healloop.autofix.decisions")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }
}
