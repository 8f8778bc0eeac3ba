package com.autoposter.engine.service;

import com.autoposter.engine.model.TaskCategory;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * One token bucket per task category, each refilled greedily to its tasks-per-minute budget.
 */
@Slf4j
public class TaskRateLimiter {

    private final Map<TaskCategory, Bucket> buckets;

    public TaskRateLimiter(Map<TaskCategory, Bucket> buckets) {
        this.buckets = new EnumMap<>(buckets);
    }

    public static TaskRateLimiter perMinute(Map<TaskCategory, Long> tasksPerMinute) {
        Map<TaskCategory, Bucket> buckets = new EnumMap<>(TaskCategory.class);
        tasksPerMinute.forEach((category, limit) -> buckets.put(category, Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(limit)
                        .refillGreedy(limit, Duration.ofMinutes(1))
                        .build())
                .build()));
        return new TaskRateLimiter(buckets);
    }

    public boolean tryConsume(TaskCategory category) {
        boolean consumed = bucket(category).tryConsume(1);
        if (!consumed) {
            log.debug("Rate limit reached for {}", category);
        }
        return consumed;
    }

    /**
     * Gives back a token taken for work that was never started.
     */
    public void refund(TaskCategory category) {
        bucket(category).addTokens(1);
    }

    public long availableTokens(TaskCategory category) {
        return bucket(category).getAvailableTokens();
    }

    private Bucket bucket(TaskCategory category) {
        Bucket bucket = buckets.get(category);
        if (bucket == null) {
            throw new IllegalArgumentException("No rate limit configured for " + category);
        }
        return bucket;
    }
}
