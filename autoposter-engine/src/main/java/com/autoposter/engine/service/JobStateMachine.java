package com.autoposter.engine.service;

import com.autoposter.engine.exception.IllegalJobStateTransitionException;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transition table of the job lifecycle.
 * <p>
 * PENDING to FAILED is the pending-wait timeout. Terminal states have no outgoing edges; the
 * operator retry of a FAILED or CANCELLED job is a separate, budget-checked path
 * ({@link #isManualRetryAllowed(UploadJob)}).
 */
@Component
public class JobStateMachine {

    private static final Map<JobStatus, Set<JobStatus>> VALID_TRANSITIONS = new EnumMap<>(JobStatus.class);

    static {
        VALID_TRANSITIONS.put(JobStatus.PENDING, EnumSet.of(JobStatus.RUNNING, JobStatus.FAILED, JobStatus.CANCELLED));
        VALID_TRANSITIONS.put(JobStatus.RUNNING,
                EnumSet.of(JobStatus.COMPLETED, JobStatus.RETRYING, JobStatus.FAILED, JobStatus.CANCELLED));
        VALID_TRANSITIONS.put(JobStatus.RETRYING, EnumSet.of(JobStatus.PENDING, JobStatus.CANCELLED));
        VALID_TRANSITIONS.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        VALID_TRANSITIONS.put(JobStatus.FAILED, EnumSet.noneOf(JobStatus.class));
        VALID_TRANSITIONS.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
    }

    public boolean canTransition(JobStatus from, JobStatus to) {
        return from != null && VALID_TRANSITIONS.get(from).contains(to);
    }

    public void validate(UploadJob job, JobStatus to) {
        if (!canTransition(job.getStatus(), to)) {
            throw new IllegalJobStateTransitionException(
                    "Job " + job.getId() + " cannot move from " + job.getStatus() + " to " + to);
        }
    }

    public Set<JobStatus> allowedTransitions(JobStatus from) {
        return Collections.unmodifiableSet(VALID_TRANSITIONS.get(from));
    }

    public boolean isManualRetryAllowed(UploadJob job) {
        return (job.getStatus() == JobStatus.FAILED || job.getStatus() == JobStatus.CANCELLED)
                && job.getRetryCount() < job.getMaxRetries();
    }
}
