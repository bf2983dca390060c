package com.healloop.core.proposal;

/**
 * Thrown when a proposal's patch cannot be applied. The proposal stays pending and no
 * file is left half-written.
 */
public class PatchApplicationException extends RuntimeException {
    public PatchApplicationException(String message) {
        super(message);
    }

    public PatchApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
