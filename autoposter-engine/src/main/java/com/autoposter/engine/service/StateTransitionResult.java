package com.autoposter.engine.service;

import com.autoposter.engine.model.JobStatus;
import lombok.Builder;
import lombok.Data;

/** Outcome of a lifecycle request. A discarded result left the job untouched. */
@Builder
@Data
public class StateTransitionResult {
    private final Long jobId;
    private final boolean applied;
    private final JobStatus fromStatus;
    private final JobStatus toStatus;
    private final String message;

    public static StateTransitionResult applied(Long jobId, JobStatus fromStatus, JobStatus toStatus) {
        return StateTransitionResult.builder()
                .jobId(jobId)
                .applied(true)
                .fromStatus(fromStatus)
                .toStatus(toStatus)
                .build();
    }

    public static StateTransitionResult applied(Long jobId, JobStatus fromStatus, JobStatus toStatus, String message) {
        return StateTransitionResult.builder()
                .jobId(jobId)
                .applied(true)
                .fromStatus(fromStatus)
                .toStatus(toStatus)
                .message(message)
                .build();
    }

    public static StateTransitionResult discarded(Long jobId, JobStatus currentStatus, String reason) {
        return StateTransitionResult.builder()
                .jobId(jobId)
                .applied(false)
                .fromStatus(currentStatus)
                .toStatus(currentStatus)
                .message(reason)
                .build();
    }
}
