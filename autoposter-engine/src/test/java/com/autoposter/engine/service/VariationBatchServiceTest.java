package com.autoposter.engine.service;

import com.autoposter.engine.exception.ConfigurationException;
import com.autoposter.engine.exception.RateLimitExceededException;
import com.autoposter.engine.model.Campaign;
import com.autoposter.engine.model.TaskCategory;
import com.autoposter.engine.repository.CampaignRepository;
import com.autoposter.variation.VariationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class VariationBatchServiceTest {

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private VariationEngine variationEngine;

    private Campaign campaign;

    @BeforeEach
    void setUp() {
        campaign = new Campaign();
        campaign.setId(1L);
        campaign.setVideoPaths(List.of("/videos/a.mp4", "/videos/b.mp4"));
        lenient().when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
    }

    @Test
    void testBatchUsesFirstVideoAndCampaignSeedRange() {
        campaign.setRandomSeed(42L);

        service(1).batch(1L, 3);

        verify(variationEngine).batch(eq(Paths.get("/videos/a.mp4")), eq(3), eq(Paths.get("/work/batch_1")),
                eq(4_200_000L), any(BooleanSupplier.class));
    }

    @Test
    void testBatchSizeIsBounded() {
        assertThatThrownBy(() -> service(1).batch(1L, 0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> service(1).batch(1L, 501))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Batch size must be between 1 and 500, got 501");
    }

    @Test
    void testBatchWithoutVideos() {
        campaign.setVideoPaths(List.of());

        assertThatThrownBy(() -> service(1).batch(1L, 3)).hasMessage("Campaign 1 has no videos");
    }

    @Test
    void testBatchBudget() {
        VariationBatchService service = service(1);
        service.batch(1L, 1);

        assertThatThrownBy(() -> service.batch(1L, 1)).isInstanceOf(RateLimitExceededException.class);
    }

    private VariationBatchService service(long batchesPerMinute) {
        return new VariationBatchService(campaignRepository, variationEngine,
                TaskRateLimiter.perMinute(Map.of(TaskCategory.BATCH_VIDEO, batchesPerMinute)), "/work", 500);
    }
}
