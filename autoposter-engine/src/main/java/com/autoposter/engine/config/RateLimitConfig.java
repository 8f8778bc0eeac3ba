package com.autoposter.engine.config;

import com.autoposter.engine.model.TaskCategory;
import com.autoposter.engine.service.TaskRateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;


@Configuration
public class RateLimitConfig {

    @Value("${rate-limiter.upload-per-minute:10}")
    private long uploadPerMinute;

    @Value("${rate-limiter.account-test-per-minute:30}")
    private long accountTestPerMinute;

    @Value("${rate-limiter.proxy-check-per-minute:60}")
    private long proxyCheckPerMinute;

    @Value("${rate-limiter.batch-video-per-minute:5}")
    private long batchVideoPerMinute;

    @Bean
    public TaskRateLimiter taskRateLimiter() {
        Map<TaskCategory, Long> limits = new EnumMap<>(TaskCategory.class);
        limits.put(TaskCategory.UPLOAD, uploadPerMinute);
        limits.put(TaskCategory.ACCOUNT_TEST, accountTestPerMinute);
        limits.put(TaskCategory.PROXY_CHECK, proxyCheckPerMinute);
        limits.put(TaskCategory.BATCH_VIDEO, batchVideoPerMinute);
        return TaskRateLimiter.perMinute(limits);
    }
}
