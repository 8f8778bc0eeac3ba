package com.autoposter.engine.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DispatchReport {
    boolean skipped;
    int due;
    int dispatched;
    int busy;
    int rateLimited;
    int stale;
    int deferred;
    int runningTimedOut;
    int pendingTimedOut;

    public static DispatchReport skippedTick() {
        return DispatchReport.builder().skipped(true).build();
    }
}
