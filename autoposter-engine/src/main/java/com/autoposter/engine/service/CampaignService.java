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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Campaign lifecycle: DRAFT, then RUNNING once planned, PAUSED and back, and finally
 * COMPLETED when every job is terminal or CANCELLED on request.
 */
@Slf4j
@Service
public class CampaignService {

    private final CampaignRepository campaignRepository;
    private final UploadJobRepository jobRepository;
    private final CampaignPlannerService plannerService;
    private final JobLifecycleService lifecycleService;
    private final JobExecutionService executionService;
    private final Clock clock;
    private final int defaultMaxRetries;

    public CampaignService(CampaignRepository campaignRepository,
                           UploadJobRepository jobRepository,
                           CampaignPlannerService plannerService,
                           JobLifecycleService lifecycleService,
                           JobExecutionService executionService,
                           Clock clock,
                           @Value("${jobs.default-max-retries:3}") int defaultMaxRetries) {
        this.campaignRepository = campaignRepository;
        this.jobRepository = jobRepository;
        this.plannerService = plannerService;
        this.lifecycleService = lifecycleService;
        this.executionService = executionService;
        this.clock = clock;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Campaign create(Campaign campaign) {
        if (campaign.getName() == null || campaign.getName().isBlank()) {
            throw new ConfigurationException("Campaign name is required");
        }
        if (campaign.getMaxRetries() < 0) {
            throw new ConfigurationException("maxRetries must not be negative");
        }
        Instant now = clock.instant();
        campaign.setId(null);
        campaign.setStatus(CampaignStatus.DRAFT);
        campaign.setCreatedAt(now);
        campaign.setUpdatedAt(now);
        Campaign saved = campaignRepository.save(campaign);
        log.info("Created campaign {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    public Campaign newDraft() {
        Campaign campaign = new Campaign();
        campaign.setMaxRetries(defaultMaxRetries);
        return campaign;
    }

    public Campaign get(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
    }

    /**
     * Plans the campaign and moves it to RUNNING. A planner failure propagates and leaves the
     * campaign and its (absent) jobs untouched.
     */
    @Transactional
    public Campaign start(Long campaignId) {
        Campaign campaign = get(campaignId);
        if (!campaign.getStatus().isStartable()) {
            throw new IllegalCampaignStateException(campaignId, campaign.getStatus(), "start");
        }
        List<UploadJob> jobs = plannerService.plan(campaign);

        Instant now = clock.instant();
        campaign.setStatus(CampaignStatus.RUNNING);
        campaign.setStartedAt(now);
        campaign.setUpdatedAt(now);
        Campaign saved = campaignRepository.save(campaign);
        log.info("Campaign {} started with {} jobs", campaignId, jobs.size());
        return saved;
    }

    public Campaign pause(Long campaignId) {
        Campaign campaign = get(campaignId);
        if (campaign.getStatus() != CampaignStatus.RUNNING) {
            throw new IllegalCampaignStateException(campaignId, campaign.getStatus(), "pause");
        }
        campaign.setStatus(CampaignStatus.PAUSED);
        campaign.setUpdatedAt(clock.instant());
        Campaign saved = campaignRepository.save(campaign);
        int held = lifecycleService.hold(campaignId);
        log.info("Campaign {} paused, {} jobs held", campaignId, held);
        return saved;
    }

    public Campaign resume(Long campaignId) {
        Campaign campaign = get(campaignId);
        if (campaign.getStatus() != CampaignStatus.PAUSED) {
            throw new IllegalCampaignStateException(campaignId, campaign.getStatus(), "resume");
        }
        campaign.setStatus(CampaignStatus.RUNNING);
        campaign.setUpdatedAt(clock.instant());
        Campaign saved = campaignRepository.save(campaign);
        int released = lifecycleService.unhold(campaignId);
        log.info("Campaign {} resumed, {} jobs released", campaignId, released);
        return saved;
    }

    /**
     * Cancels every job that has not finished yet; in-flight attempts get their cancel flag.
     */
    public Campaign cancel(Long campaignId) {
        Campaign campaign = get(campaignId);
        if (campaign.getStatus().isFinished()) {
            throw new IllegalCampaignStateException(campaignId, campaign.getStatus(), "cancel");
        }
        Instant now = clock.instant();
        campaign.setStatus(CampaignStatus.CANCELLED);
        campaign.setCompletedAt(now);
        campaign.setUpdatedAt(now);
        Campaign saved = campaignRepository.save(campaign);

        int cancelled = 0;
        for (UploadJob job : jobRepository.findByCampaignIdAndStatusIn(campaignId, JobStatus.ACTIVE)) {
            if (lifecycleService.cancel(job.getId()).isApplied()) {
                executionService.cancel(job.getId());
                cancelled++;
            }
        }
        log.info("Campaign {} cancelled, {} jobs cancelled", campaignId, cancelled);
        return saved;
    }

    public CampaignSummary summary(Long campaignId) {
        Campaign campaign = get(campaignId);
        return CampaignSummary.of(campaignId, campaign.getStatus(), jobRepository.countByStatusForCampaign(campaignId));
    }

    /**
     * Marks a RUNNING campaign COMPLETED once all of its jobs are terminal.
     */
    public boolean refreshCompletion(Long campaignId) {
        Campaign campaign = get(campaignId);
        if (campaign.getStatus() != CampaignStatus.RUNNING) {
            return false;
        }
        if (jobRepository.countByCampaignIdAndStatusIn(campaignId, JobStatus.ACTIVE) > 0) {
            return false;
        }
        Instant now = clock.instant();
        campaign.setStatus(CampaignStatus.COMPLETED);
        campaign.setCompletedAt(now);
        campaign.setUpdatedAt(now);
        campaignRepository.save(campaign);
        log.info("Campaign {} completed: {}", campaignId, summary(campaignId).getText());
        return true;
    }

    /**
     * Re-queues the failed jobs that still have retry budget. A completed campaign is reopened
     * when anything was re-queued.
     */
    public int retryFailed(Long campaignId) {
        Campaign campaign = get(campaignId);
        if (campaign.getStatus() == CampaignStatus.CANCELLED) {
            throw new IllegalCampaignStateException(campaignId, campaign.getStatus(), "retry jobs of");
        }
        int retried = 0;
        for (UploadJob job : jobRepository.findByCampaignIdAndStatus(campaignId, JobStatus.FAILED)) {
            if (job.getRetryCount() < job.getMaxRetries()) {
                lifecycleService.retry(job.getId());
                retried++;
            }
        }
        if (retried > 0) {
            reopen(campaign);
        }
        log.info("Re-queued {} failed jobs of campaign {}", retried, campaignId);
        return retried;
    }

    public int reconcileRunningCampaigns() {
        int completed = 0;
        for (Campaign campaign : campaignRepository.findByStatus(CampaignStatus.RUNNING)) {
            if (refreshCompletion(campaign.getId())) {
                completed++;
            }
        }
        return completed;
    }

    void reopen(Campaign campaign) {
        if (campaign.getStatus() == CampaignStatus.COMPLETED) {
            campaign.setStatus(CampaignStatus.RUNNING);
            campaign.setCompletedAt(null);
            campaign.setUpdatedAt(clock.instant());
            campaignRepository.save(campaign);
            log.info("Campaign {} reopened", campaign.getId());
        }
    }
}
