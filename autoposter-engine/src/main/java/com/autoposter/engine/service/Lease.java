package com.autoposter.engine.service;

import lombok.Value;

import java.time.Instant;

/**
 * Exclusive hold on an account for the RUNNING duration of one job. The proxy is carried
 * along from the account record and is not leased on its own.
 */
@Value
public class Lease {
    Long accountId;
    Long proxyId;
    Long jobId;
    Long campaignId;
    String token;
    Instant acquiredAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
