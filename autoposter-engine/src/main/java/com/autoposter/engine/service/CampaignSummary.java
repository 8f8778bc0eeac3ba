package com.autoposter.engine.service;

import com.autoposter.engine.model.CampaignStatus;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.repository.JobStatusCount;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of a campaign's jobs, e.g. {@code "12/50 completed, 3 failed"}.
 */
@Value
public class CampaignSummary {
    Long campaignId;
    CampaignStatus status;
    long total;
    long completed;
    long failed;
    long cancelled;
    long active;
    double successRate;
    Map<JobStatus, Long> byStatus;
    String text;

    public static CampaignSummary of(Long campaignId, CampaignStatus status, List<JobStatusCount> counts) {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (JobStatus jobStatus : JobStatus.values()) {
            byStatus.put(jobStatus, 0L);
        }
        for (JobStatusCount count : counts) {
            byStatus.merge(count.getStatus(), count.getTotal(), Long::sum);
        }

        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        long completed = byStatus.get(JobStatus.COMPLETED);
        long failed = byStatus.get(JobStatus.FAILED);
        long cancelled = byStatus.get(JobStatus.CANCELLED);
        long active = byStatus.get(JobStatus.PENDING) + byStatus.get(JobStatus.RUNNING) + byStatus.get(JobStatus.RETRYING);
        double successRate = total == 0 ? 0.0 : Math.round(completed * 1000.0 / total) / 10.0;

        StringBuilder text = new StringBuilder()
                .append(completed).append('/').append(total).append(" completed, ")
                .append(failed).append(" failed");
        if (cancelled > 0) {
            text.append(", ").append(cancelled).append(" cancelled");
        }
        return new CampaignSummary(campaignId, status, total, completed, failed, cancelled, active, successRate,
                byStatus, text.toString());
    }
}
