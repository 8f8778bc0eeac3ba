package com.autoposter.engine.exception;

public class ResourceTimeoutException extends AutoPosterException {
    public ResourceTimeoutException(String message) {
        super(message);
    }
}
