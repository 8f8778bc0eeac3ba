package com.autoposter.engine.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Random;

/**
 * {@code min(max, base * 2^(retryCount - 1)) + jitter}, jitter uniform in {@code [0, maxJitter]}.
 * The jitter source is seeded from the job id and retry count, so a given attempt always gets
 * the same delay.
 */
@Component
public class ExponentialBackoffPolicy implements BackoffPolicy {

    private static final int MAX_SHIFT = 30;

    private final Duration base;
    private final Duration max;
    private final Duration maxJitter;

    public ExponentialBackoffPolicy(@Value("${backoff.base:PT60S}") Duration base,
                                    @Value("${backoff.max:PT10M}") Duration max,
                                    @Value("${backoff.max-jitter:PT30S}") Duration maxJitter) {
        if (base.isNegative() || max.isNegative() || maxJitter.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        this.base = base;
        this.max = max;
        this.maxJitter = maxJitter;
    }

    @Override
    public Duration delay(long jobId, int retryCount) {
        int shift = Math.min(Math.max(retryCount - 1, 0), MAX_SHIFT);
        Duration exponential = base.multipliedBy(1L << shift);
        if (exponential.compareTo(max) > 0) {
            exponential = max;
        }
        return exponential.plus(jitter(jobId, retryCount));
    }

    Duration jitter(long jobId, int retryCount) {
        if (maxJitter.isZero()) {
            return Duration.ZERO;
        }
        Random random = new Random(jobId * 31L + retryCount);
        return Duration.ofMillis(Math.round(random.nextDouble() * maxJitter.toMillis()));
    }
}
