package com.healloop.core.knowledge;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers which fixes worked for which errors.
 */
public interface KnowledgeStore {

    /** Metadata key holding an initial success rate for {@link #addErrorSolution}. */
    String SUCCESS_RATE = "success_rate";

    /**
     * Looks up a solution: an exact pattern match first, then a case-insensitive match
     * where either text contains the other.
     */
    Optional<ErrorSolution> findErrorSolution(String errorMessage);

    /**
     * Stores (or replaces) the solution for {@code pattern}. A numeric {@value #SUCCESS_RATE}
     * entry in {@code metadata} sets the initial success rate.
     */
    ErrorSolution addErrorSolution(String pattern, String solution, Map<String, Object> metadata);

    /** @throws IllegalArgumentException when no solution is stored under {@code pattern} */
    ErrorSolution updateSuccessRate(String pattern, double successRate);

    List<ErrorSolution> all();
}
