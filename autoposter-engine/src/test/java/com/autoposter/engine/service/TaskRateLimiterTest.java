package com.autoposter.engine.service;

import com.autoposter.engine.model.TaskCategory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskRateLimiterTest {

    private final TaskRateLimiter limiter = TaskRateLimiter.perMinute(Map.of(
            TaskCategory.UPLOAD, 2L,
            TaskCategory.PROXY_CHECK, 5L));

    @Test
    void testBudgetIsExhausted() {
        assertThat(limiter.tryConsume(TaskCategory.UPLOAD)).isTrue();
        assertThat(limiter.tryConsume(TaskCategory.UPLOAD)).isTrue();
        assertThat(limiter.tryConsume(TaskCategory.UPLOAD)).isFalse();
    }

    @Test
    void testCategoriesAreIndependent() {
        limiter.tryConsume(TaskCategory.UPLOAD);
        limiter.tryConsume(TaskCategory.UPLOAD);

        assertThat(limiter.tryConsume(TaskCategory.PROXY_CHECK)).isTrue();
        assertThat(limiter.availableTokens(TaskCategory.PROXY_CHECK)).isEqualTo(4);
    }

    @Test
    void testRefundReturnsToken() {
        limiter.tryConsume(TaskCategory.UPLOAD);
        limiter.tryConsume(TaskCategory.UPLOAD);

        limiter.refund(TaskCategory.UPLOAD);

        assertThat(limiter.tryConsume(TaskCategory.UPLOAD)).isTrue();
    }

    @Test
    void testUnconfiguredCategory() {
        assertThatThrownBy(() -> limiter.tryConsume(TaskCategory.BATCH_VIDEO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
