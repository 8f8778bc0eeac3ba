package com.autoposter.engine.client;

import com.autoposter.engine.model.Proxy;

/**
 * Browser-automation upload backend.
 * <p>
 * Implementations throw {@link com.autoposter.engine.exception.RetryableUploadException} for
 * transient failures and {@link com.autoposter.engine.exception.FatalUploadException} for
 * permanent ones (banned account, captcha wall). A returned result with {@code success == false}
 * is classified by its {@link UploadResult#getErrorKind() error kind}.
 */
public interface UploadClient {

    UploadResult upload(Long accountId, Proxy proxy, String videoPath, String caption);

    boolean testAuthentication(Long accountId);
}
