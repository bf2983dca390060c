package com.healloop.core.engine;

/**
 * States of one execution. An attempt ends in {@link #SUCCESS}, {@link #RETRY},
 * {@link #GUARDRAIL_BREACH} or {@link #TERMINAL_EXCEPTION}.
 */
public enum ExecutionPhase {
    BUILD_CONTRACT,
    VALIDATE_PAYLOAD,
    ATTEMPT,
    SUCCESS,
    RETRY,
    GUARDRAIL_BREACH,
    TERMINAL_EXCEPTION,
    FINALIZE
}
