package com.autoposter.engine.endpoint;

import com.autoposter.engine.dto.ApiResponse;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import com.autoposter.engine.service.JobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<UploadJob>>> list(
            @RequestParam(value = "campaignId", required = false) Long campaignId,
            @RequestParam(value = "status", required = false) JobStatus status) {
        return ResponseEntity.ok(ApiResponse.ok(jobService.list(campaignId, status)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<UploadJob>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok(jobService.get(id)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<ApiResponse<UploadJob>> retry(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok("Job queued for retry", jobService.retry(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<UploadJob>> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok("Job cancelled", jobService.cancel(id)));
    }
}
