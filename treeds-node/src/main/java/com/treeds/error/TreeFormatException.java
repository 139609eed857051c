package com.treeds.error;

/**
 * Thrown when a tree cannot be rendered as text (no root, or a child id that does not resolve).
 */
public final class TreeFormatException extends TreeException {

    public TreeFormatException(String message) {
        super(message);
    }

    public TreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
