package com.autoposter.engine.client;

import com.autoposter.engine.model.JobErrorKind;
import lombok.Value;

@Value
public class UploadResult {
    boolean success;
    String remoteUrl;
    String error;
    JobErrorKind errorKind;

    public static UploadResult success(String remoteUrl) {
        return new UploadResult(true, remoteUrl, null, null);
    }

    public static UploadResult failure(String error, JobErrorKind errorKind) {
        return new UploadResult(false, null, error, errorKind);
    }
}
