package com.healloop.core.llm;

/**
 * The planning oracle boundary: one blocking prompt in, raw text content out.
 * <p>
 * Callers never use this directly; they go through {@link OracleCall}, which adds
 * the timeout, JSON extraction and fallback handling.
 */
@FunctionalInterface
public interface Oracle {

    String invoke(String prompt);
}
