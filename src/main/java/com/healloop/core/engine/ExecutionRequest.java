package com.healloop.core.engine;

import com.healloop.core.guardrail.CancellationToken;
import com.healloop.core.learning.ComplexityAnalysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tool invocation to run under the engine.
 *
 * @param request      the user's natural-language request
 * @param tool         tool to invoke
 * @param params       raw tool parameters
 * @param complexity   upstream complexity analysis, or null to have the engine ask for one
 * @param cancellation checked between attempts
 */
public record ExecutionRequest(
    String request,
    String tool,
    Map<String, Object> params,
    ComplexityAnalysis complexity,
    CancellationToken cancellation
) {
    public ExecutionRequest {
        if (tool == null || tool.isBlank()) {
            throw new IllegalArgumentException("tool must not be blank");
        }
        request = request == null ? "" : request;
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    public static ExecutionRequest of(String request, String tool, Map<String, Object> params) {
        return new ExecutionRequest(request, tool, params, null, null);
    }
}
