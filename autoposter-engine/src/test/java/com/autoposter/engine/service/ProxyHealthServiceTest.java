package com.autoposter.engine.service;

import com.autoposter.engine.client.ProxyCheckResult;
import com.autoposter.engine.client.ProxyHealthChecker;
import com.autoposter.engine.exception.RateLimitExceededException;
import com.autoposter.engine.exception.ResourceNotFoundException;
import com.autoposter.engine.model.Proxy;
import com.autoposter.engine.model.ProxyStatus;
import com.autoposter.engine.model.TaskCategory;
import com.autoposter.engine.repository.ProxyRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProxyHealthServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    @Mock
    private ProxyRepository proxyRepository;

    @Mock
    private ProxyHealthChecker healthChecker;

    @Test
    void testCheckUpdatesProxyAndCachesResult() {
        Proxy proxy = new Proxy(1L, "10.0.0.1", 8080);
        when(proxyRepository.findById(1L)).thenReturn(Optional.of(proxy));
        when(healthChecker.check(proxy)).thenReturn(new ProxyCheckResult(1L, ProxyStatus.ACTIVE, 42, null, NOW));
        ProxyHealthService service = service(5);

        ProxyCheckResult result = service.checkProxy(1L);

        assertThat(result.isHealthy()).isTrue();
        assertThat(proxy.getLatencyMs()).isEqualTo(42);
        assertThat(proxy.getLastCheckedAt()).isEqualTo(NOW);
        assertThat(service.lastResult(1L)).contains(result);
        verify(proxyRepository).save(proxy);
    }

    @Test
    void testCheckerExceptionMarksProxyErrored() {
        Proxy proxy = new Proxy(1L, "10.0.0.1", 8080);
        when(proxyRepository.findById(1L)).thenReturn(Optional.of(proxy));
        when(healthChecker.check(proxy)).thenThrow(new IllegalStateException("resolver down"));

        ProxyCheckResult result = service(5).checkProxy(1L);

        assertThat(result.getStatus()).isEqualTo(ProxyStatus.ERROR);
        assertThat(proxy.getStatus()).isEqualTo(ProxyStatus.ERROR);
    }

    @Test
    void testCheckBeyondBudgetIsRejected() {
        Proxy proxy = new Proxy(1L, "10.0.0.1", 8080);
        when(proxyRepository.findById(1L)).thenReturn(Optional.of(proxy));
        when(healthChecker.check(proxy)).thenReturn(new ProxyCheckResult(1L, ProxyStatus.ACTIVE, 5, null, NOW));
        ProxyHealthService service = service(1);
        service.checkProxy(1L);

        assertThatThrownBy(() -> service.checkProxy(1L))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessage("Rate limit reached for PROXY_CHECK tasks, try again later");
        verify(healthChecker, times(1)).check(proxy);
    }

    @Test
    void testUnknownProxy() {
        when(proxyRepository.findById(3L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service(5).checkProxy(3L)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void testSweepSkipsBannedAndDefersOverBudget() {
        Proxy banned = new Proxy(1L, "10.0.0.1", 8080);
        banned.setStatus(ProxyStatus.BANNED);
        Proxy first = new Proxy(2L, "10.0.0.2", 8080);
        Proxy second = new Proxy(3L, "10.0.0.3", 8080);
        when(proxyRepository.findAll()).thenReturn(List.of(banned, first, second));
        when(healthChecker.check(any(Proxy.class)))
                .thenAnswer(inv -> new ProxyCheckResult(inv.<Proxy>getArgument(0).getId(), ProxyStatus.ACTIVE, 10, null, NOW));

        int checked = service(1).checkAllProxies();

        assertThat(checked).isEqualTo(1);
        verify(healthChecker, never()).check(banned);
        verify(healthChecker).check(first);
        verify(healthChecker, never()).check(second);
    }

    private ProxyHealthService service(long checksPerMinute) {
        return new ProxyHealthService(proxyRepository, healthChecker,
                TaskRateLimiter.perMinute(Map.of(TaskCategory.PROXY_CHECK, checksPerMinute)));
    }
}
