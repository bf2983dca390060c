package com.healloop.core.learning;

import java.util.List;

/**
 * Upstream analysis of a user request: how complex it is and which capabilities it needs.
 */
public record ComplexityAnalysis(
    ComplexityLevel complexity,
    List<String> requiredDomains,
    boolean capabilitiesSufficient,
    List<String> missingCapabilities,
    String reasoning
) {
    public ComplexityAnalysis {
        complexity = complexity == null ? ComplexityLevel.UNKNOWN : complexity;
        requiredDomains = requiredDomains == null ? List.of() : List.copyOf(requiredDomains);
        missingCapabilities = missingCapabilities == null ? List.of() : List.copyOf(missingCapabilities);
    }

    public static ComplexityAnalysis unknown(String reasoning) {
        return new ComplexityAnalysis(ComplexityLevel.UNKNOWN, List.of(), true, List.of(), reasoning);
    }

    public static ComplexityAnalysis of(ComplexityLevel level) {
        return new ComplexityAnalysis(level, List.of(), true, List.of(), "");
    }
}
