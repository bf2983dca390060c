package com.healloop.core.llm;

/**
 * Thrown when an oracle call does not answer within the configured timeout.
 */
public class LlmTimeoutException extends RuntimeException {

    public LlmTimeoutException(String message) {
        super(message);
    }

    public LlmTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
