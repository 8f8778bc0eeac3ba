package com.autoposter.engine.service;

import com.autoposter.engine.exception.ConfigurationException;
import com.autoposter.engine.exception.IllegalCampaignStateException;
import com.autoposter.engine.exception.ResourceNotFoundException;
import com.autoposter.engine.model.Campaign;
import com.autoposter.engine.model.CampaignStatus;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import com.autoposter.engine.repository.CampaignRepository;
import com.autoposter.engine.repository.UploadJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CampaignServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T07:00:00Z");

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private UploadJobRepository jobRepository;

    @Mock
    private CampaignPlannerService plannerService;

    @Mock
    private JobLifecycleService lifecycleService;

    @Mock
    private JobExecutionService executionService;

    private CampaignService campaignService;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        campaignService = new CampaignService(campaignRepository, jobRepository, plannerService, lifecycleService,
                executionService, new TestClock(NOW), 3);
        campaign = new Campaign();
        campaign.setId(1L);
        campaign.setName("launch");
        lenient().when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        lenient().when(campaignRepository.save(any(Campaign.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void testCreateStoresDraft() {
        Campaign draft = campaignService.newDraft();
        draft.setName("summer");
        draft.setStatus(CampaignStatus.RUNNING);

        Campaign created = campaignService.create(draft);

        assertThat(created.getStatus()).isEqualTo(CampaignStatus.DRAFT);
        assertThat(created.getMaxRetries()).isEqualTo(3);
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void testCreateRequiresName() {
        assertThatThrownBy(() -> campaignService.create(new Campaign()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Campaign name is required");
    }

    @Test
    void testStartPlansAndRuns() {
        when(plannerService.plan(campaign)).thenReturn(List.of(new UploadJob()));

        Campaign started = campaignService.start(1L);

        assertThat(started.getStatus()).isEqualTo(CampaignStatus.RUNNING);
        assertThat(started.getStartedAt()).isEqualTo(NOW);
    }

    @Test
    void testPlannerFailureLeavesDraft() {
        when(plannerService.plan(campaign)).thenThrow(new ConfigurationException("Accounts not found: [8]"));

        assertThatThrownBy(() -> campaignService.start(1L)).isInstanceOf(ConfigurationException.class);
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.DRAFT);
        verify(campaignRepository, never()).save(any(Campaign.class));
    }

    @Test
    void testStartTwiceIsRejected() {
        campaign.setStatus(CampaignStatus.RUNNING);

        assertThatThrownBy(() -> campaignService.start(1L))
                .isInstanceOf(IllegalCampaignStateException.class)
                .hasMessage("Cannot start campaign 1 in status RUNNING");
        verify(plannerService, never()).plan(any());
    }

    @Test
    void testPauseAndResumeHoldJobs() {
        campaign.setStatus(CampaignStatus.RUNNING);

        campaignService.pause(1L);
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.PAUSED);
        verify(lifecycleService).hold(1L);

        campaignService.resume(1L);
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.RUNNING);
        verify(lifecycleService).unhold(1L);
    }

    @Test
    void testResumeOfRunningCampaignIsRejected() {
        campaign.setStatus(CampaignStatus.RUNNING);

        assertThatThrownBy(() -> campaignService.resume(1L)).isInstanceOf(IllegalCampaignStateException.class);
    }

    @Test
    void testCancelStopsActiveJobs() {
        campaign.setStatus(CampaignStatus.RUNNING);
        UploadJob pending = Jobs.job(10, 1, 1, NOW);
        UploadJob running = Jobs.running(11, 2, "t", NOW);
        when(jobRepository.findByCampaignIdAndStatusIn(1L, JobStatus.ACTIVE)).thenReturn(List.of(pending, running));
        when(lifecycleService.cancel(10L)).thenReturn(StateTransitionResult.applied(10L, JobStatus.PENDING, JobStatus.CANCELLED));
        when(lifecycleService.cancel(11L)).thenReturn(StateTransitionResult.discarded(11L, JobStatus.COMPLETED, "Job already finished"));

        campaignService.cancel(1L);

        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.CANCELLED);
        verify(executionService).cancel(10L);
        verify(executionService, never()).cancel(11L);
    }

    @Test
    void testCompletesWhenNoJobIsActive() {
        campaign.setStatus(CampaignStatus.RUNNING);
        when(jobRepository.countByCampaignIdAndStatusIn(1L, JobStatus.ACTIVE)).thenReturn(0L);

        assertThat(campaignService.refreshCompletion(1L)).isTrue();
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.COMPLETED);
    }

    @Test
    void testStaysRunningWhileJobsAreActive() {
        campaign.setStatus(CampaignStatus.RUNNING);
        when(jobRepository.countByCampaignIdAndStatusIn(1L, JobStatus.ACTIVE)).thenReturn(2L);

        assertThat(campaignService.refreshCompletion(1L)).isFalse();
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.RUNNING);
    }

    @Test
    void testRetryFailedReopensCompletedCampaign() {
        campaign.setStatus(CampaignStatus.COMPLETED);
        UploadJob withBudget = Jobs.job(10, 1, 1, NOW);
        withBudget.setStatus(JobStatus.FAILED);
        UploadJob exhausted = Jobs.job(11, 1, 2, NOW);
        exhausted.setStatus(JobStatus.FAILED);
        exhausted.setRetryCount(3);
        when(jobRepository.findByCampaignIdAndStatus(1L, JobStatus.FAILED)).thenReturn(List.of(withBudget, exhausted));

        int retried = campaignService.retryFailed(1L);

        assertThat(retried).isEqualTo(1);
        verify(lifecycleService).retry(10L);
        verify(lifecycleService, never()).retry(11L);
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.RUNNING);
    }

    @Test
    void testRetryFailedOfCancelledCampaignIsRejected() {
        campaign.setStatus(CampaignStatus.CANCELLED);

        assertThatThrownBy(() -> campaignService.retryFailed(1L)).isInstanceOf(IllegalCampaignStateException.class);
    }

    @Test
    void testUnknownCampaign() {
        when(campaignRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> campaignService.get(9L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Campaign not found: 9");
    }
}
