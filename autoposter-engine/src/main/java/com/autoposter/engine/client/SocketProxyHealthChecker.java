package com.autoposter.engine.client;

import com.autoposter.engine.model.Proxy;
import com.autoposter.engine.model.ProxyStatus;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Clock;
import java.time.Duration;

/**
 * Treats a proxy as healthy when a TCP connection to it opens within the timeout.
 */
@Slf4j
public class SocketProxyHealthChecker implements ProxyHealthChecker {

    private final Clock clock;
    private final Duration connectTimeout;

    public SocketProxyHealthChecker(Clock clock, Duration connectTimeout) {
        this.clock = clock;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public ProxyCheckResult check(Proxy proxy) {
        long started = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(proxy.getHost(), proxy.getPort()), (int) connectTimeout.toMillis());
            int latency = (int) Duration.ofNanos(System.nanoTime() - started).toMillis();
            return new ProxyCheckResult(proxy.getId(), ProxyStatus.ACTIVE, latency, null, clock.instant());
        } catch (IOException e) {
            log.warn("Proxy {} unreachable: {}", proxy.address(), e.getMessage());
            return new ProxyCheckResult(proxy.getId(), ProxyStatus.ERROR, null, e.getMessage(), clock.instant());
        }
    }
}
