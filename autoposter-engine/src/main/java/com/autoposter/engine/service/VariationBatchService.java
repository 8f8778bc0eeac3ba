package com.autoposter.engine.service;

import com.autoposter.engine.exception.ConfigurationException;
import com.autoposter.engine.exception.RateLimitExceededException;
import com.autoposter.engine.exception.ResourceNotFoundException;
import com.autoposter.engine.model.Campaign;
import com.autoposter.engine.model.TaskCategory;
import com.autoposter.engine.repository.CampaignRepository;
import com.autoposter.variation.BatchResult;
import com.autoposter.variation.VariationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Pre-renders variations of a campaign's first video, outside the job lifecycle.
 */
@Slf4j
@Service
public class VariationBatchService {

    static final long SEEDS_PER_CAMPAIGN = 100_000L;

    private final CampaignRepository campaignRepository;
    private final VariationEngine variationEngine;
    private final TaskRateLimiter rateLimiter;
    private final Path workDir;
    private final int maxBatchSize;

    public VariationBatchService(CampaignRepository campaignRepository,
                                 VariationEngine variationEngine,
                                 TaskRateLimiter rateLimiter,
                                 @Value("${variation.work-dir:${java.io.tmpdir}/autoposter}") String workDir,
                                 @Value("${variation.max-batch-size:500}") int maxBatchSize) {
        this.campaignRepository = campaignRepository;
        this.variationEngine = variationEngine;
        this.rateLimiter = rateLimiter;
        this.workDir = Paths.get(workDir);
        this.maxBatchSize = maxBatchSize;
    }

    public BatchResult batch(Long campaignId, int count) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
        if (campaign.getVideoPaths() == null || campaign.getVideoPaths().isEmpty()) {
            throw new ConfigurationException("Campaign " + campaignId + " has no videos");
        }
        if (count <= 0 || count > maxBatchSize) {
            throw new ConfigurationException("Batch size must be between 1 and " + maxBatchSize + ", got " + count);
        }
        if (!rateLimiter.tryConsume(TaskCategory.BATCH_VIDEO)) {
            throw new RateLimitExceededException(TaskCategory.BATCH_VIDEO);
        }

        long baseSeed = (campaign.getRandomSeed() != null ? campaign.getRandomSeed() : campaignId) * SEEDS_PER_CAMPAIGN;
        Path source = Paths.get(campaign.getVideoPaths().get(0));
        Path outputDir = workDir.resolve("batch_" + campaignId);
        log.info("Batch of {} variations for campaign {} into {}", count, campaignId, outputDir);
        return variationEngine.batch(source, count, outputDir, baseSeed, () -> Thread.currentThread().isInterrupted());
    }
}
