package com.autoposter.engine.exception;

public class IllegalJobStateTransitionException extends AutoPosterException {
    public IllegalJobStateTransitionException(String message) {
        super(message);
    }
}
