package com.autoposter.engine.service;

import com.autoposter.engine.model.Campaign;
import com.autoposter.engine.model.CampaignStatus;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import com.autoposter.engine.repository.CampaignRepository;
import com.autoposter.engine.repository.UploadJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Recurring tick that turns due jobs into running attempts.
 * <p>
 * A tick first fails RUNNING jobs past the hard timeout and PENDING jobs that waited too long,
 * then walks the due jobs in (scheduledAt, id) order. Each dispatch reserves a worker slot,
 * leases the account, takes a rate-limit token and marks the job RUNNING; whatever is
 * missing leaves the job PENDING for a later tick. Ticks never overlap.
 */
@Slf4j
@Service
public class DispatcherService {

    private final UploadJobRepository jobRepository;
    private final CampaignRepository campaignRepository;
    private final ResourceAllocator allocator;
    private final TaskRateLimiter rateLimiter;
    private final JobLifecycleService lifecycleService;
    private final JobExecutionService executionService;
    private final WorkerPool workerPool;
    private final Clock clock;
    private final Duration maxPendingWait;
    private final Duration jobHardTimeout;

    private final ReentrantLock tickLock = new ReentrantLock();

    enum Outcome { DISPATCHED, BUSY, RATE_LIMITED, STALE, SATURATED }

    public DispatcherService(UploadJobRepository jobRepository,
                             CampaignRepository campaignRepository,
                             ResourceAllocator allocator,
                             TaskRateLimiter rateLimiter,
                             JobLifecycleService lifecycleService,
                             JobExecutionService executionService,
                             WorkerPool workerPool,
                             Clock clock,
                             @Value("${dispatcher.max-pending-wait:PT2H}") Duration maxPendingWait,
                             @Value("${dispatcher.job-hard-timeout:PT30M}") Duration jobHardTimeout) {
        this.jobRepository = jobRepository;
        this.campaignRepository = campaignRepository;
        this.allocator = allocator;
        this.rateLimiter = rateLimiter;
        this.lifecycleService = lifecycleService;
        this.executionService = executionService;
        this.workerPool = workerPool;
        this.clock = clock;
        this.maxPendingWait = maxPendingWait;
        this.jobHardTimeout = jobHardTimeout;
    }

    @Scheduled(fixedDelayString = "${dispatcher.tick-interval-ms:1000}")
    public void scheduledTick() {
        DispatchReport report = tick();
        if (report.getDispatched() > 0 || report.getRunningTimedOut() > 0 || report.getPendingTimedOut() > 0) {
            log.info("Dispatch tick: {}", report);
        }
    }

    public DispatchReport tick() {
        if (!tickLock.tryLock()) {
            log.debug("Previous tick still running, skipping");
            return DispatchReport.skippedTick();
        }
        try {
            return runTick(clock.instant());
        } finally {
            tickLock.unlock();
        }
    }

    private DispatchReport runTick(Instant now) {
        DispatchReport.DispatchReportBuilder report = DispatchReport.builder();
        report.runningTimedOut(expireRunning(now));

        Set<Long> runningCampaigns = campaignRepository.findByStatus(CampaignStatus.RUNNING).stream()
                .map(Campaign::getId)
                .collect(Collectors.toSet());
        report.pendingTimedOut(expirePending(now, runningCampaigns));

        List<UploadJob> due = jobRepository
                .findByStatusAndHeldFalseAndScheduledAtLessThanEqualOrderByScheduledAtAscIdAsc(JobStatus.PENDING, now)
                .stream()
                .filter(job -> runningCampaigns.contains(job.getCampaignId()))
                .collect(Collectors.toList());
        report.due(due.size());

        int dispatched = 0;
        int busy = 0;
        int rateLimited = 0;
        int stale = 0;
        int deferred = 0;
        for (int i = 0; i < due.size(); i++) {
            Outcome outcome = dispatch(due.get(i));
            if (outcome == Outcome.SATURATED) {
                deferred = due.size() - i;
                log.debug("Worker pool saturated, {} due jobs wait for the next tick", deferred);
                break;
            }
            switch (outcome) {
                case DISPATCHED:
                    dispatched++;
                    break;
                case BUSY:
                    busy++;
                    break;
                case RATE_LIMITED:
                    rateLimited++;
                    break;
                default:
                    stale++;
                    break;
            }
        }
        return report.dispatched(dispatched)
                .busy(busy)
                .rateLimited(rateLimited)
                .stale(stale)
                .deferred(deferred)
                .build();
    }

    Outcome dispatch(UploadJob job) {
        if (!workerPool.tryReserve()) {
            return Outcome.SATURATED;
        }
        Optional<Lease> acquired = allocator.tryAcquire(job);
        if (acquired.isEmpty()) {
            workerPool.cancelReservation();
            return Outcome.BUSY;
        }
        Lease lease = acquired.get();
        if (!rateLimiter.tryConsume(job.getCategory())) {
            allocator.release(lease);
            workerPool.cancelReservation();
            return Outcome.RATE_LIMITED;
        }

        StateTransitionResult running;
        try {
            running = lifecycleService.markRunning(job.getId(), lease.getToken());
        } catch (RuntimeException e) {
            undo(job, lease);
            throw e;
        }
        if (!running.isApplied()) {
            log.debug("Job {} no longer dispatchable: {}", job.getId(), running.getMessage());
            undo(job, lease);
            return Outcome.STALE;
        }

        ExecutionHandle handle = executionService.register(job.getId(), lease);
        try {
            workerPool.submitReserved(() -> executionService.execute(handle));
        } catch (RejectedExecutionException e) {
            // Pool is shutting down; the slot was already given back
            log.warn("Worker pool rejected job {}, returning it to the queue", job.getId());
            executionService.abandon(handle);
            allocator.release(lease);
            rateLimiter.refund(job.getCategory());
            lifecycleService.requeue(job.getId(), lease.getToken(), "Worker pool rejected the attempt");
            return Outcome.SATURATED;
        }
        return Outcome.DISPATCHED;
    }

    private void undo(UploadJob job, Lease lease) {
        allocator.release(lease);
        rateLimiter.refund(job.getCategory());
        workerPool.cancelReservation();
    }

    private int expireRunning(Instant now) {
        int expired = 0;
        for (UploadJob job : jobRepository.findByStatusAndStartedAtBefore(JobStatus.RUNNING, now.minus(jobHardTimeout))) {
            StateTransitionResult result = lifecycleService.failTimedOut(job.getId(),
                    "Exceeded hard timeout of " + jobHardTimeout);
            if (result.isApplied()) {
                executionService.cancel(job.getId());
                allocator.revoke(job.getAccountId(), job.getId());
                expired++;
            }
        }
        return expired;
    }

    private int expirePending(Instant now, Set<Long> runningCampaigns) {
        Instant cutoff = now.minus(maxPendingWait);
        int expired = 0;
        for (UploadJob job : jobRepository.findByStatusAndHeldFalseAndScheduledAtBefore(JobStatus.PENDING, cutoff)) {
            // Waiting counts from the later of the slot and the last resume or retry
            boolean waitedSinceUpdate = job.getUpdatedAt() == null || job.getUpdatedAt().isBefore(cutoff);
            if (!runningCampaigns.contains(job.getCampaignId()) || !waitedSinceUpdate) {
                continue;
            }
            StateTransitionResult result = lifecycleService.failPendingTimeout(job.getId(),
                    "No lease or rate-limit token within " + maxPendingWait);
            if (result.isApplied()) {
                expired++;
            }
        }
        return expired;
    }
}
