package com.autoposter.engine.service;

import com.autoposter.engine.exception.IllegalJobStateTransitionException;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStateMachineTest {

    private final JobStateMachine stateMachine = new JobStateMachine();

    @Test
    void testForwardTransitions() {
        assertThat(stateMachine.canTransition(JobStatus.PENDING, JobStatus.RUNNING)).isTrue();
        assertThat(stateMachine.canTransition(JobStatus.RUNNING, JobStatus.COMPLETED)).isTrue();
        assertThat(stateMachine.canTransition(JobStatus.RUNNING, JobStatus.RETRYING)).isTrue();
        assertThat(stateMachine.canTransition(JobStatus.RETRYING, JobStatus.PENDING)).isTrue();
        assertThat(stateMachine.canTransition(JobStatus.RUNNING, JobStatus.FAILED)).isTrue();
    }

    @Test
    void testCancelOnlyFromActiveStates() {
        for (JobStatus status : JobStatus.values()) {
            assertThat(stateMachine.canTransition(status, JobStatus.CANCELLED)).isEqualTo(!status.isTerminal());
        }
    }

    @Test
    void testTerminalStatesHaveNoExits() {
        for (JobStatus terminal : JobStatus.TERMINAL) {
            assertThat(stateMachine.allowedTransitions(terminal)).isEmpty();
        }
    }

    @Test
    void testRejectsSkippingRunning() {
        UploadJob job = Jobs.job(1, 1, 1, Instant.EPOCH);

        assertThatThrownBy(() -> stateMachine.validate(job, JobStatus.COMPLETED))
                .isInstanceOf(IllegalJobStateTransitionException.class);
        assertThat(stateMachine.canTransition(JobStatus.PENDING, JobStatus.RETRYING)).isFalse();
    }

    @Test
    void testManualRetryNeedsBudget() {
        UploadJob job = Jobs.job(1, 1, 1, Instant.EPOCH);
        job.setStatus(JobStatus.FAILED);
        job.setRetryCount(2);

        assertThat(stateMachine.isManualRetryAllowed(job)).isTrue();
        job.setRetryCount(3);
        assertThat(stateMachine.isManualRetryAllowed(job)).isFalse();
        job.setRetryCount(0);
        job.setStatus(JobStatus.COMPLETED);
        assertThat(stateMachine.isManualRetryAllowed(job)).isFalse();
    }
}
