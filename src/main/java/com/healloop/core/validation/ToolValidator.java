package com.healloop.core.validation;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ground-truth checks for one or more tools. Each method returns human-readable issues;
 * an empty list means the value is acceptable.
 */
public interface ToolValidator {

    /** Tool names this validator covers. */
    Set<String> tools();

    /** Checks a result the tool reported as successful. Never called with {@code null}. */
    List<String> validateResult(Object result);

    /** Checks the outgoing payload before the first attempt. */
    default List<String> validateParameters(Map<String, Object> params) {
        return List.of();
    }
}
