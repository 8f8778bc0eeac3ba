package com.autoposter.engine.repository;

import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface UploadJobRepository extends JpaRepository<UploadJob, Long> {

    /** Dispatch order: scheduled time, then id. */
    List<UploadJob> findByStatusAndHeldFalseAndScheduledAtLessThanEqualOrderByScheduledAtAscIdAsc(
            JobStatus status, Instant now);

    List<UploadJob> findByStatusAndHeldFalseAndScheduledAtBefore(JobStatus status, Instant cutoff);

    List<UploadJob> findByStatusAndStartedAtBefore(JobStatus status, Instant cutoff);

    List<UploadJob> findByStatus(JobStatus status);

    List<UploadJob> findByCampaignIdOrderByScheduledAtAscIdAsc(Long campaignId);

    List<UploadJob> findByCampaignIdAndStatus(Long campaignId, JobStatus status);

    List<UploadJob> findByCampaignIdAndStatusIn(Long campaignId, Collection<JobStatus> statuses);

    long countByCampaignIdAndStatusIn(Long campaignId, Collection<JobStatus> statuses);

    boolean existsByCampaignIdAndContentHashAndIdNot(Long campaignId, String contentHash, Long id);

    @Query("select j.status as status, count(j) as total from UploadJob j "
            + "where j.campaignId = :campaignId group by j.status")
    List<JobStatusCount> countByStatusForCampaign(@Param("campaignId") Long campaignId);
}
