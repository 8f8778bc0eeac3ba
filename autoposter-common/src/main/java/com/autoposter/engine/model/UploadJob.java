package com.autoposter.engine.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One account / video / time unit of work derived from a campaign.
 * <p>
 * Created once by the planner and afterwards mutated only through the lifecycle service.
 * {@code held} is the pause sub-state: a held PENDING job is skipped by the dispatcher
 * without its retry budget being touched.
 */
@Entity
@Data
@NoArgsConstructor
@Table(name = "upload_jobs", indexes = {
    @Index(name = "idx_job_status_scheduled", columnList = "status, held, scheduled_at"),
    @Index(name = "idx_job_campaign", columnList = "campaign_id"),
    @Index(name = "idx_job_account_status", columnList = "account_id, status")
})
public class UploadJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    private Long proxyId;

    @Column(length = 500)
    private String videoPath;

    @Column(length = 2200)
    private String caption;

    @Enumerated(EnumType.STRING)
    private JobStatus status = JobStatus.PENDING;

    private boolean held;

    @Enumerated(EnumType.STRING)
    private TaskCategory category = TaskCategory.UPLOAD;

    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    private Instant startedAt;
    private Instant completedAt;

    private int retryCount;
    private int maxRetries = 3;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    private JobErrorKind errorKind;

    // Fencing token of the current RUNNING attempt
    private String attemptToken;

    private String remoteUrl;
    private String outputPath;
    private String contentHash;

    private Instant createdAt;
    private Instant updatedAt;

    @Version
    private Long version;

    public UploadJob(Long campaignId, Long accountId, Long proxyId, String videoPath, String caption,
                     Instant scheduledAt, int maxRetries) {
        this.campaignId = campaignId;
        this.accountId = accountId;
        this.proxyId = proxyId;
        this.videoPath = videoPath;
        this.caption = caption;
        this.scheduledAt = scheduledAt;
        this.maxRetries = maxRetries;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
