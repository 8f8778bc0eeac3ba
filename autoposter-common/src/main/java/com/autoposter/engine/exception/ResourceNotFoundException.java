package com.autoposter.engine.exception;

public class ResourceNotFoundException extends AutoPosterException {
    public ResourceNotFoundException(String type, Long id) {
        super(type + " not found: " + id);
    }
}
