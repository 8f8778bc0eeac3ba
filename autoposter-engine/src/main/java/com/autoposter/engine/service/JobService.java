package com.autoposter.engine.service;

import com.autoposter.engine.exception.IllegalCampaignStateException;
import com.autoposter.engine.exception.IllegalJobStateTransitionException;
import com.autoposter.engine.exception.ResourceNotFoundException;
import com.autoposter.engine.model.Campaign;
import com.autoposter.engine.model.CampaignStatus;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import com.autoposter.engine.repository.CampaignRepository;
import com.autoposter.engine.repository.UploadJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobService {

    private final UploadJobRepository jobRepository;
    private final CampaignRepository campaignRepository;
    private final JobLifecycleService lifecycleService;
    private final JobExecutionService executionService;
    private final CampaignService campaignService;

    public List<UploadJob> list(Long campaignId, JobStatus status) {
        if (campaignId != null && status != null) {
            return jobRepository.findByCampaignIdAndStatus(campaignId, status);
        }
        if (campaignId != null) {
            return jobRepository.findByCampaignIdOrderByScheduledAtAscIdAsc(campaignId);
        }
        if (status != null) {
            return jobRepository.findByStatus(status);
        }
        return jobRepository.findAll();
    }

    public UploadJob get(Long jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
    }

    /**
     * Operator retry of one job. Jobs of a cancelled campaign stay where they are, since nothing
     * would ever dispatch them.
     */
    public UploadJob retry(Long jobId) {
        UploadJob job = get(jobId);
        Optional<Campaign> campaign = campaignRepository.findById(job.getCampaignId());
        if (campaign.isPresent() && campaign.get().getStatus() == CampaignStatus.CANCELLED) {
            throw new IllegalCampaignStateException(job.getCampaignId(), CampaignStatus.CANCELLED, "retry jobs of");
        }
        lifecycleService.retry(jobId);
        campaign.ifPresent(campaignService::reopen);
        return get(jobId);
    }

    public UploadJob cancel(Long jobId) {
        StateTransitionResult result = lifecycleService.cancel(jobId);
        if (!result.isApplied()) {
            throw new IllegalJobStateTransitionException(
                    "Job " + jobId + " cannot be cancelled in status " + result.getFromStatus());
        }
        executionService.cancel(jobId);
        return get(jobId);
    }
}
