package com.autoposter.engine.service;

import java.time.Duration;
import java.time.Instant;

public interface BackoffPolicy {

    /**
     * Delay before attempt {@code retryCount + 1}; {@code retryCount} is already incremented
     * for the failure being handled, so the first retry passes 1.
     */
    Duration delay(long jobId, int retryCount);

    default Instant nextAttempt(Instant now, long jobId, int retryCount) {
        return now.plus(delay(jobId, retryCount));
    }
}
