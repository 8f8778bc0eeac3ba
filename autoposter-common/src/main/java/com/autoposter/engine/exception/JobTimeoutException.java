package com.autoposter.engine.exception;

public class JobTimeoutException extends AutoPosterException {
    public JobTimeoutException(String message) {
        super(message);
    }
}
