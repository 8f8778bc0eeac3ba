package com.autoposter.engine.client;

import com.autoposter.engine.model.ProxyStatus;
import lombok.Value;

import java.time.Instant;

@Value
public class ProxyCheckResult {
    Long proxyId;
    ProxyStatus status;
    Integer latencyMs;
    String error;
    Instant checkedAt;

    public boolean isHealthy() {
        return status == ProxyStatus.ACTIVE;
    }
}
