package com.autoposter.engine.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusTest {

    @Test
    void testTerminalAndActiveSetsPartitionStatuses() {
        assertThat(JobStatus.TERMINAL).containsExactlyInAnyOrder(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);
        assertThat(JobStatus.ACTIVE).doesNotContainAnyElementsOf(JobStatus.TERMINAL);
        assertThat(JobStatus.ACTIVE.size() + JobStatus.TERMINAL.size()).isEqualTo(JobStatus.values().length);
    }

    @Test
    void testCampaignStartability() {
        assertThat(CampaignStatus.DRAFT.isStartable()).isTrue();
        assertThat(CampaignStatus.PAUSED.isStartable()).isFalse();
        assertThat(CampaignStatus.CANCELLED.isFinished()).isTrue();
        assertThat(CampaignStatus.RUNNING.isFinished()).isFalse();
    }
}
