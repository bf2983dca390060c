package com.healloop.core.guardrail;

import com.healloop.core.contract.ExecutionContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Derives per-execution {@link Guardrails} by overlaying a contract's
 * {@code execution_constraints} onto the configured defaults.
 * <p>
 * Only known keys are considered, and an override is taken only when it is a number
 * that stays positive after conversion. Anything else is ignored.
 */
@Component
public class GuardrailEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GuardrailEvaluator.class);

    private final GuardrailProperties properties;

    public GuardrailEvaluator(GuardrailProperties properties) {
        this.properties = properties;
    }

    public Guardrails derive(ExecutionContract contract) {
        Map<String, Object> constraints = contract == null ? Map.of() : contract.executionConstraints();
        int attempts = properties.getMaxAttempts();
        double duration = properties.getMaxDurationSeconds();
        int payload = properties.getMaxPayloadChars();

        if (constraints.get(Guardrails.MAX_ATTEMPTS) instanceof Number n && n.intValue() > 0) {
            attempts = n.intValue();
        } else if (constraints.containsKey(Guardrails.MAX_ATTEMPTS)) {
            log.debug("Ignoring invalid max_attempts override: {}", constraints.get(Guardrails.MAX_ATTEMPTS));
        }
        if (constraints.get(Guardrails.MAX_DURATION_SECONDS) instanceof Number n && n.doubleValue() > 0) {
            duration = n.doubleValue();
        } else if (constraints.containsKey(Guardrails.MAX_DURATION_SECONDS)) {
            log.debug("Ignoring invalid max_duration_seconds override: {}",
                    constraints.get(Guardrails.MAX_DURATION_SECONDS));
        }
        if (constraints.get(Guardrails.MAX_PAYLOAD_CHARS) instanceof Number n && n.intValue() > 0) {
            payload = n.intValue();
        } else if (constraints.containsKey(Guardrails.MAX_PAYLOAD_CHARS)) {
            log.debug("Ignoring invalid max_payload_chars override: {}", constraints.get(Guardrails.MAX_PAYLOAD_CHARS));
        }
        return new Guardrails(attempts, duration, payload);
    }

    /** Retry policy for one execution, with the configured backoff. */
    public RetryPolicy retryPolicy(Guardrails guardrails, CancellationToken cancellation) {
        return new RetryPolicy(guardrails, properties.getBackoffMillis(), cancellation);
    }
}
