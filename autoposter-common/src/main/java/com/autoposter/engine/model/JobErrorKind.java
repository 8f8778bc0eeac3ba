package com.autoposter.engine.model;

/**
 * Classification of the last failure recorded on an upload job.
 */
public enum JobErrorKind {
    TRANSIENT,
    PERMANENT,
    ACCOUNT_BANNED,
    CAPTCHA_REQUIRED,
    VARIATION_FAILED,
    DUPLICATE_CONTENT,
    RESOURCE_TIMEOUT,
    TIMEOUT,
    CANCELLED
}
