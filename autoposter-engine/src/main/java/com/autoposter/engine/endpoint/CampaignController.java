package com.autoposter.engine.endpoint;

import com.autoposter.engine.dto.ApiResponse;
import com.autoposter.engine.dto.BatchRequest;
import com.autoposter.engine.dto.BatchResponse;
import com.autoposter.engine.dto.CreateCampaignRequest;
import com.autoposter.engine.model.AccountSelection;
import com.autoposter.engine.model.Campaign;
import com.autoposter.engine.model.CampaignSchedule;
import com.autoposter.engine.service.CampaignService;
import com.autoposter.engine.service.CampaignSummary;
import com.autoposter.engine.service.VariationBatchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Map;

@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignService campaignService;
    private final VariationBatchService batchService;

    @PostMapping
    public ResponseEntity<ApiResponse<Campaign>> create(@Valid @RequestBody CreateCampaignRequest request) {
        Campaign campaign = campaignService.create(toCampaign(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Campaign created", campaign));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Campaign>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok(campaignService.get(id)));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<ApiResponse<Campaign>> start(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok("Campaign started", campaignService.start(id)));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<ApiResponse<Campaign>> pause(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok("Campaign paused", campaignService.pause(id)));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<ApiResponse<Campaign>> resume(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok("Campaign resumed", campaignService.resume(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<Campaign>> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok("Campaign cancelled", campaignService.cancel(id)));
    }

    @GetMapping("/{id}/summary")
    public ResponseEntity<ApiResponse<CampaignSummary>> summary(@PathVariable Long id) {
        CampaignSummary summary = campaignService.summary(id);
        return ResponseEntity.ok(ApiResponse.ok(summary.getText(), summary));
    }

    @PostMapping("/{id}/retry-failed")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> retryFailed(@PathVariable Long id) {
        int retried = campaignService.retryFailed(id);
        return ResponseEntity.ok(ApiResponse.ok("Re-queued " + retried + " jobs", Map.of("retried", retried)));
    }

    @PostMapping("/{id}/batch-variations")
    public ResponseEntity<ApiResponse<BatchResponse>> batchVariations(@PathVariable Long id,
                                                                      @Valid @RequestBody BatchRequest request) {
        BatchResponse response = BatchResponse.from(batchService.batch(id, request.count()));
        return ResponseEntity.ok(ApiResponse.ok(response.succeeded() + "/" + response.requested() + " variations created",
                response));
    }

    private Campaign toCampaign(CreateCampaignRequest request) {
        Campaign campaign = campaignService.newDraft();
        campaign.setName(request.getName());
        campaign.setVideoPaths(new ArrayList<>(request.getVideoPaths()));
        campaign.setCaptionTemplate(request.getCaptionTemplate());
        campaign.setAccountSelection(new AccountSelection(request.getStrategy(), request.getSampleSize(),
                request.getAccountIds() == null ? new ArrayList<>() : new ArrayList<>(request.getAccountIds()),
                request.getProxyId(), request.getMaxAccounts()));
        campaign.setSchedule(new CampaignSchedule(request.getStartTime(), request.getEndTime(),
                request.getDelayMinSeconds(), request.getDelayMaxSeconds()));
        if (request.getMaxRetries() != null) {
            campaign.setMaxRetries(request.getMaxRetries());
        }
        campaign.setRandomSeed(request.getRandomSeed());
        return campaign;
    }
}
