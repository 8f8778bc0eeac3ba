package com.autoposter.engine.model;

public enum CampaignStatus {
    DRAFT,
    SCHEDULED,
    RUNNING,
    PAUSED,
    COMPLETED,
    CANCELLED;

    public boolean isStartable() {
        return this == DRAFT || this == SCHEDULED;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED;
    }
}
