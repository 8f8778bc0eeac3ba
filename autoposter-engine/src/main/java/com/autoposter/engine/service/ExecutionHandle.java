package com.autoposter.engine.service;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One in-flight attempt: the lease it runs under and its cooperative cancel flag.
 * The lease token doubles as the attempt token that fences result reports.
 */
@Getter
public class ExecutionHandle {

    private final Long jobId;
    private final Lease lease;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ExecutionHandle(Long jobId, Lease lease) {
        this.jobId = jobId;
        this.lease = lease;
    }

    public String getAttemptToken() {
        return lease.getToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
