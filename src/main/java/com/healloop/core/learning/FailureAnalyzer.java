package com.healloop.core.learning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.llm.OracleCall;
import com.healloop.core.memory.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Diagnoses failed attempts and suggests alternatives.
 * <p>
 * Every failure is recorded in the shared failure-pattern history before the oracle is
 * consulted, so recurrence counting works even when the oracle is down. Oracle failures
 * degrade to {@link FailureAnalysis#unavailable(int)}.
 */
@Service
public class FailureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FailureAnalyzer.class);

    private final OracleCall oracleCall;
    private final BoundedHistory<FailurePattern> failurePatterns;
    private final ObjectMapper objectMapper;

    public FailureAnalyzer(OracleCall oracleCall, BoundedHistory<FailurePattern> failurePatterns,
                           ObjectMapper objectMapper) {
        this.oracleCall = oracleCall;
        this.failurePatterns = failurePatterns;
        this.objectMapper = objectMapper;
    }

    /**
     * Records the failure and asks the oracle for a diagnosis.
     *
     * @param tool    the tool that failed
     * @param error   error text reported by the tool or a validator
     * @param context attempt context (request, payload, attempt number, ...)
     */
    public FailureAnalysis analyze(String tool, String error, Map<String, Object> context) {
        Object attempt = context == null ? null : context.get("attempt");
        int recurrence = (int) failurePatterns.appendAndCount(
                new FailurePattern(Instant.now(), tool, error, attempt instanceof Number n ? n.intValue() : 0),
                p -> Objects.equals(p.tool(), tool) && Objects.equals(p.error(), error));

        String prompt = """
                Analyze this tool failure and suggest a fix.

                Tool: %s
                Error: %s
                Context: %s
                Recurrence: %d time(s)

                Return JSON only:
                {
                  "root_cause": "explanation",
                  "fix_type": "code|config|documentation",
                  "suggested_fix": "detailed fix description or code",
                  "prevention": "how to prevent this in future"
                }
                """.formatted(tool, oracleCall.clip(error), oracleCall.clip(toJson(context)), recurrence);

        FailureAnalysis analysis = oracleCall.askJson("failure analysis", prompt,
                json -> interpret(json, recurrence),
                () -> FailureAnalysis.unavailable(recurrence));
        if (analysis.recurring()) {
            log.warn("Recurring failure for {} ({} times): {}", tool, analysis.recurrenceCount(), error);
        }
        log.info("Failure analysis for {}: fix_type={}, root_cause={}",
                tool, analysis.fixType().wireValue(), analysis.rootCause());
        return analysis;
    }

    /**
     * Asks for alternative ways to reach the same goal after the primary approach failed.
     * Purely advisory.
     */
    public Optional<String> suggestAlternative(String request, String failedApproach, String error) {
        String prompt = """
                A tool execution failed. Suggest 2-3 alternative approaches that could achieve the
                same goal using different tools, different API methods, different data sources or
                workarounds. Return clear, actionable steps.

                Original request: %s
                Failed approach: %s
                Error: %s
                """.formatted(request, failedApproach, oracleCall.clip(error));
        return oracleCall.askText("alternative approach", prompt);
    }

    /** Number of recorded failures for {@code tool}, across all errors. */
    long failureCount(String tool) {
        return failurePatterns.count(p -> Objects.equals(p.tool(), tool));
    }

    private static Optional<FailureAnalysis> interpret(JsonNode json, int recurrence) {
        if (!json.hasNonNull("root_cause")) {
            return Optional.empty();
        }
        return Optional.of(new FailureAnalysis(
                json.path("root_cause").asText(),
                FixType.fromWire(json.path("fix_type").asText(null)),
                json.path("suggested_fix").asText(""),
                json.path("prevention").asText(""),
                recurrence));
    }

    private String toJson(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context);
        } catch (JsonProcessingException e) {
            return String.valueOf(context);
        }
    }
}
