package com.autoposter.engine.exception;

/**
 * Transient execution failure. Charged against the job's retry budget.
 */
public class RetryableUploadException extends AutoPosterException {
    public RetryableUploadException(String message) {
        super(message);
    }

    public RetryableUploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
