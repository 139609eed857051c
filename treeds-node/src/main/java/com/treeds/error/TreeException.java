package com.treeds.error;

/**
 * Base type of every recoverable failure raised by tree and node operations.
 * Callers decide whether to retry with different arguments or give up; nothing is retried internally.
 */
public class TreeException extends RuntimeException {

    public TreeException(String message) {
        super(message);
    }

    public TreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
