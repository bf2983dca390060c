package com.healloop.core.knowledge;

/**
 * Thrown when a file-backed store cannot be read or written.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
