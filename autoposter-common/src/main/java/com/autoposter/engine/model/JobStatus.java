package com.autoposter.engine.model;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    PENDING,
    RUNNING,
    RETRYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);
    public static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, RUNNING, RETRYING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
