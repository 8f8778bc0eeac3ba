package com.autoposter.engine.exception;

/**
 * Root of the engine's unchecked exception hierarchy.
 */
public class AutoPosterException extends RuntimeException {
    public AutoPosterException(String message) {
        super(message);
    }

    public AutoPosterException(String message, Throwable cause) {
        super(message, cause);
    }
}
