package com.healloop.core.engine;

import java.util.Map;

/**
 * Invokes a concrete tool. Implementations live outside the engine.
 */
@FunctionalInterface
public interface ToolCallback {

    /**
     * @param toolName tool to run
     * @param payload  final payload, after the contract filled any gaps
     * @return the tool's own report; a thrown exception counts as an "exception" attempt
     */
    ToolOutcome execute(String toolName, Map<String, Object> payload) throws Exception;
}
