package com.healloop.core.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A structured plan for one tool invocation: which inputs it needs, what success looks
 * like and which limits apply. Built once per request and never mutated.
 *
 * @param tool                 tool the contract was negotiated for
 * @param intent               one-line statement of what the invocation should achieve
 * @param inputs               required/optional fields and planner-supplied payload values
 * @param preconditions        conditions expected to hold before the first attempt
 * @param successCriteria      how to recognise a successful result
 * @param postValidations      checks to run on the result
 * @param fallbackPlan         what to try when the primary approach fails
 * @param executionConstraints limit overrides ({@code max_attempts}, {@code max_duration_seconds}, ...)
 * @param fallback             true when the planner could not be used and this is the deterministic contract
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExecutionContract(
    String tool,
    String intent,
    ContractInputs inputs,
    List<String> preconditions,
    List<String> successCriteria,
    List<String> postValidations,
    List<String> fallbackPlan,
    Map<String, Object> executionConstraints,
    boolean fallback
) {
    public ExecutionContract {
        inputs = inputs == null ? new ContractInputs(List.of(), List.of(), Map.of()) : inputs;
        preconditions = copy(preconditions);
        successCriteria = copy(successCriteria);
        postValidations = copy(postValidations);
        fallbackPlan = copy(fallbackPlan);
        executionConstraints = executionConstraints == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(executionConstraints));
    }

    /**
     * The deterministic contract used whenever the planner is unavailable or answers
     * with something unusable: every provided parameter is required and the payload
     * passes through unchanged.
     */
    public static ExecutionContract fallbackFor(String tool, String userRequest, Map<String, Object> params) {
        List<Object> required = params == null ? List.of() : new ArrayList<>(params.keySet());
        return new ExecutionContract(
                tool,
                "Execute " + tool + " for request: " + (userRequest == null ? "" : userRequest),
                new ContractInputs(required, List.of(), Map.of()),
                List.of(),
                List.of("Tool reports status=success", "Result passes ground-truth validation"),
                List.of(),
                List.of(),
                Map.of(),
                true);
    }

    /**
     * Flattens {@code inputs.required} into field names. Accepts plain strings and
     * {@code {"name": ...}} objects; blank or nameless entries are dropped.
     */
    public List<String> requiredFields() {
        var names = new ArrayList<String>();
        for (Object entry : inputs.required()) {
            String name = null;
            if (entry instanceof String s) {
                name = s;
            } else if (entry instanceof Map<?, ?> m && m.get("name") != null) {
                name = String.valueOf(m.get("name"));
            }
            if (name != null && !name.isBlank()) {
                names.add(name.trim());
            }
        }
        return names;
    }

    /**
     * Merges {@code inputs.final_payload} over the caller's parameters. Caller values win
     * when both sides are present; contract values only fill gaps.
     */
    public Map<String, Object> finalPayload(Map<String, Object> originalParams) {
        var merged = new LinkedHashMap<String, Object>();
        if (originalParams != null) {
            merged.putAll(originalParams);
        }
        for (var entry : inputs.finalPayload().entrySet()) {
            if (PayloadValues.isMissing(entry.getValue())) continue;
            if (PayloadValues.isMissing(merged.get(entry.getKey()))) {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }

    /**
     * Required fields that are still missing from {@code payload}.
     */
    public List<String> missingFields(Map<String, Object> payload) {
        return requiredFields().stream()
                .filter(field -> PayloadValues.isMissing(payload.get(field)))
                .toList();
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
