package com.autoposter.variation;

import lombok.Getter;

/**
 * Tagged failure of the variation pipeline, carrying the stage that failed.
 */
@Getter
public class VariationException extends RuntimeException {

    public enum Kind {
        SOURCE_NOT_FOUND,
        ENCODER_UNAVAILABLE,
        ENCODE_FAILED,
        TIMEOUT,
        CANCELLED
    }

    public enum Stage {
        PREPARE,
        PROBE,
        ENCODE,
        HASH
    }

    private final Kind kind;
    private final Stage stage;
    private final String diagnostic;

    public VariationException(Kind kind, Stage stage, String message) {
        this(kind, stage, message, null, null);
    }

    public VariationException(Kind kind, Stage stage, String message, String diagnostic) {
        this(kind, stage, message, diagnostic, null);
    }

    public VariationException(Kind kind, Stage stage, String message, String diagnostic, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
        this.diagnostic = diagnostic;
    }

    @Override
    public String getMessage() {
        String base = "[" + kind + " at " + stage + "] " + super.getMessage();
        return diagnostic == null || diagnostic.isBlank() ? base : base + ": " + diagnostic;
    }
}
