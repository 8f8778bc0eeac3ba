package com.autoposter.engine.service;

import com.autoposter.engine.client.ProxyCheckResult;
import com.autoposter.engine.client.ProxyHealthChecker;
import com.autoposter.engine.exception.RateLimitExceededException;
import com.autoposter.engine.exception.ResourceNotFoundException;
import com.autoposter.engine.model.Proxy;
import com.autoposter.engine.model.ProxyStatus;
import com.autoposter.engine.model.TaskCategory;
import com.autoposter.engine.repository.ProxyRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Proxy health checks on their own PROXY_CHECK budget, independent of job execution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProxyHealthService {

    private final ProxyRepository proxyRepository;
    private final ProxyHealthChecker healthChecker;
    private final TaskRateLimiter rateLimiter;

    private final Cache<Long, ProxyCheckResult> lastResults = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(1, TimeUnit.HOURS)
            .build();

    public ProxyCheckResult checkProxy(Long proxyId) {
        Proxy proxy = proxyRepository.findById(proxyId)
                .orElseThrow(() -> new ResourceNotFoundException("Proxy", proxyId));
        if (!rateLimiter.tryConsume(TaskCategory.PROXY_CHECK)) {
            throw new RateLimitExceededException(TaskCategory.PROXY_CHECK);
        }
        return runCheck(proxy);
    }

    /**
     * Checks every proxy that is not banned. Proxies left once the budget is spent wait for
     * the next sweep. Returns the number checked.
     */
    public int checkAllProxies() {
        int checked = 0;
        int deferred = 0;
        for (Proxy proxy : proxyRepository.findAll()) {
            if (proxy.getStatus() == ProxyStatus.BANNED) {
                continue;
            }
            if (!rateLimiter.tryConsume(TaskCategory.PROXY_CHECK)) {
                deferred++;
                continue;
            }
            runCheck(proxy);
            checked++;
        }
        log.info("Proxy sweep: {} checked, {} deferred", checked, deferred);
        return checked;
    }

    public Optional<ProxyCheckResult> lastResult(Long proxyId) {
        return Optional.ofNullable(lastResults.getIfPresent(proxyId));
    }

    private ProxyCheckResult runCheck(Proxy proxy) {
        ProxyCheckResult result;
        try {
            result = healthChecker.check(proxy);
        } catch (RuntimeException e) {
            log.error("Health check of proxy {} failed", proxy.getId(), e);
            result = new ProxyCheckResult(proxy.getId(), ProxyStatus.ERROR, null, e.getMessage(), null);
        }
        proxy.setStatus(result.getStatus());
        proxy.setLatencyMs(result.getLatencyMs());
        proxy.setLastCheckedAt(result.getCheckedAt());
        proxyRepository.save(proxy);
        lastResults.put(proxy.getId(), result);
        log.info("Proxy {} is {} ({} ms)", proxy.address(), result.getStatus(), result.getLatencyMs());
        return result;
    }
}
