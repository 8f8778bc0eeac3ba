package com.autoposter.engine.exception;

import com.autoposter.engine.model.JobErrorKind;
import lombok.Getter;

/**
 * Permanent execution failure, the job fails without further attempts.
 */
@Getter
public class FatalUploadException extends AutoPosterException {
    private final JobErrorKind errorKind;

    public FatalUploadException(String message) {
        this(message, JobErrorKind.PERMANENT);
    }

    public FatalUploadException(String message, JobErrorKind errorKind) {
        super(message);
        this.errorKind = errorKind;
    }

    public FatalUploadException(String message, JobErrorKind errorKind, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }
}
