package com.autoposter.engine.client;

import com.autoposter.engine.exception.FatalUploadException;
import com.autoposter.engine.model.Proxy;
import lombok.extern.slf4j.Slf4j;

/**
 * Used when no upload backend is deployed. Every upload fails permanently.
 */
@Slf4j
public class UnconfiguredUploadClient implements UploadClient {

    @Override
    public UploadResult upload(Long accountId, Proxy proxy, String videoPath, String caption) {
        log.error("Upload requested for account {} but no upload backend is configured", accountId);
        throw new FatalUploadException("No upload backend configured");
    }

    @Override
    public boolean testAuthentication(Long accountId) {
        log.warn("Cannot verify account {}: no upload backend configured", accountId);
        return false;
    }
}
