package com.autoposter.engine.service;

import com.autoposter.engine.exception.FatalUploadException;
import com.autoposter.engine.exception.IllegalJobStateTransitionException;
import com.autoposter.engine.exception.JobTimeoutException;
import com.autoposter.engine.exception.ResourceNotFoundException;
import com.autoposter.engine.exception.ResourceTimeoutException;
import com.autoposter.engine.model.JobErrorKind;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import com.autoposter.engine.repository.UploadJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Applies lifecycle transitions to persisted jobs.
 * <p>
 * Transitions on one job are serialised by a striped lock, and each write is a single
 * repository save guarded by the entity version. A write that loses against another node is
 * reported as discarded. Result reports only apply while the job is RUNNING under the
 * attempt token they carry.
 */
@Slf4j
@Service
public class JobLifecycleService {

    private static final int LOCK_STRIPES = 64;

    private final UploadJobRepository jobRepository;
    private final JobStateMachine stateMachine;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public JobLifecycleService(UploadJobRepository jobRepository, JobStateMachine stateMachine,
                               BackoffPolicy backoffPolicy, Clock clock) {
        this.jobRepository = jobRepository;
        this.stateMachine = stateMachine;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public StateTransitionResult markRunning(Long jobId, String attemptToken) {
        return transition(jobId, job -> {
            if (job.getStatus() != JobStatus.PENDING || job.isHeld()) {
                return StateTransitionResult.discarded(jobId, job.getStatus(), "Job is not dispatchable");
            }
            Instant now = clock.instant();
            job.setStatus(JobStatus.RUNNING);
            job.setAttemptToken(attemptToken);
            job.setStartedAt(now);
            job.setUpdatedAt(now);
            jobRepository.save(job);
            log.info("Job {} RUNNING on account {} (attempt {})", jobId, job.getAccountId(), job.getRetryCount() + 1);
            return StateTransitionResult.applied(jobId, JobStatus.PENDING, JobStatus.RUNNING);
        });
    }

    /**
     * Stores the variation produced for the current attempt.
     */
    public StateTransitionResult recordVariation(Long jobId, String attemptToken, String outputPath, String contentHash) {
        return transition(jobId, job -> {
            if (!isCurrentAttempt(job, attemptToken)) {
                return StateTransitionResult.discarded(jobId, job.getStatus(), "Stale attempt");
            }
            job.setOutputPath(outputPath);
            job.setContentHash(contentHash);
            job.setUpdatedAt(clock.instant());
            jobRepository.save(job);
            return StateTransitionResult.applied(jobId, JobStatus.RUNNING, JobStatus.RUNNING);
        });
    }

    public StateTransitionResult reportSuccess(Long jobId, String attemptToken, String remoteUrl) {
        return transition(jobId, job -> {
            if (!isCurrentAttempt(job, attemptToken)) {
                log.warn("Discarding stale success report for job {}", jobId);
                return StateTransitionResult.discarded(jobId, job.getStatus(), "Stale or duplicate report");
            }
            Instant now = clock.instant();
            job.setStatus(JobStatus.COMPLETED);
            job.setRemoteUrl(remoteUrl);
            job.setErrorMessage(null);
            job.setErrorKind(null);
            job.setAttemptToken(null);
            job.setCompletedAt(now);
            job.setUpdatedAt(now);
            jobRepository.save(job);
            log.info("Job {} COMPLETED: {}", jobId, remoteUrl);
            return StateTransitionResult.applied(jobId, JobStatus.RUNNING, JobStatus.COMPLETED);
        });
    }

    /**
     * Classifies a failed attempt. Retryable failures within budget go through RETRYING back to
     * PENDING at the backoff time; everything else fails the job.
     */
    public StateTransitionResult reportFailure(Long jobId, String attemptToken, Throwable error) {
        return transition(jobId, job -> {
            if (!isCurrentAttempt(job, attemptToken)) {
                log.warn("Discarding stale failure report for job {}: {}", jobId, error.getMessage());
                return StateTransitionResult.discarded(jobId, job.getStatus(), "Stale or duplicate report");
            }
            JobErrorKind kind = classify(error);
            if (kind != JobErrorKind.TRANSIENT) {
                return fail(job, kind, error.getMessage());
            }
            if (job.getRetryCount() >= job.getMaxRetries()) {
                return fail(job, JobErrorKind.TRANSIENT,
                        "Retries exhausted (" + job.getMaxRetries() + "): " + error.getMessage());
            }
            return scheduleRetry(job, error.getMessage());
        });
    }

    /**
     * Returns a RUNNING attempt that never reached a worker to PENDING. Passes through RETRYING
     * but leaves the retry count, error and schedule untouched.
     */
    public StateTransitionResult requeue(Long jobId, String attemptToken, String reason) {
        return transition(jobId, job -> {
            if (!isCurrentAttempt(job, attemptToken)) {
                return StateTransitionResult.discarded(jobId, job.getStatus(), "Stale attempt");
            }
            stateMachine.validate(job, JobStatus.RETRYING);
            job.setStatus(JobStatus.PENDING);
            job.setAttemptToken(null);
            job.setStartedAt(null);
            job.setUpdatedAt(clock.instant());
            jobRepository.save(job);
            log.info("Job {} back to PENDING without using its retry budget: {}", jobId, reason);
            return StateTransitionResult.applied(jobId, JobStatus.RUNNING, JobStatus.PENDING, reason);
        });
    }

    public StateTransitionResult cancel(Long jobId) {
        return transition(jobId, job -> {
            if (!stateMachine.canTransition(job.getStatus(), JobStatus.CANCELLED)) {
                return StateTransitionResult.discarded(jobId, job.getStatus(), "Job already finished");
            }
            JobStatus from = job.getStatus();
            Instant now = clock.instant();
            job.setStatus(JobStatus.CANCELLED);
            job.setErrorKind(JobErrorKind.CANCELLED);
            job.setErrorMessage("Cancelled");
            job.setAttemptToken(null);
            job.setHeld(false);
            job.setCompletedAt(now);
            job.setUpdatedAt(now);
            jobRepository.save(job);
            log.info("Job {} CANCELLED (was {})", jobId, from);
            return StateTransitionResult.applied(jobId, from, JobStatus.CANCELLED);
        });
    }

    /**
     * Hard ceiling exceeded. Applies regardless of the attempt token.
     */
    public StateTransitionResult failTimedOut(Long jobId, String reason) {
        return transition(jobId, job -> {
            if (job.getStatus() != JobStatus.RUNNING) {
                return StateTransitionResult.discarded(jobId, job.getStatus(), "Job is not running");
            }
            return fail(job, JobErrorKind.TIMEOUT, reason);
        });
    }

    public StateTransitionResult failPendingTimeout(Long jobId, String reason) {
        return transition(jobId, job -> {
            if (job.getStatus() != JobStatus.PENDING || job.isHeld()) {
                return StateTransitionResult.discarded(jobId, job.getStatus(), "Job is not waiting");
            }
            return fail(job, JobErrorKind.RESOURCE_TIMEOUT, reason);
        });
    }

    /**
     * Puts the campaign's PENDING jobs into the held sub-state. Returns how many were held.
     */
    public int hold(Long campaignId) {
        return setHeld(campaignId, true);
    }

    public int unhold(Long campaignId) {
        return setHeld(campaignId, false);
    }

    /**
     * Operator retry of a FAILED or CANCELLED job. Uses one unit of the retry budget.
     */
    public StateTransitionResult retry(Long jobId) {
        return transition(jobId, job -> {
            if (!stateMachine.isManualRetryAllowed(job)) {
                throw new IllegalJobStateTransitionException("Job " + jobId + " cannot be retried (status "
                        + job.getStatus() + ", retries " + job.getRetryCount() + "/" + job.getMaxRetries() + ")");
            }
            JobStatus from = job.getStatus();
            job.setStatus(JobStatus.PENDING);
            job.setRetryCount(job.getRetryCount() + 1);
            job.setErrorMessage(null);
            job.setErrorKind(null);
            job.setAttemptToken(null);
            job.setCompletedAt(null);
            job.setUpdatedAt(clock.instant());
            jobRepository.save(job);
            log.info("Job {} re-queued by operator (retry {}/{})", jobId, job.getRetryCount(), job.getMaxRetries());
            return StateTransitionResult.applied(jobId, from, JobStatus.PENDING);
        });
    }

    static JobErrorKind classify(Throwable error) {
        if (error instanceof FatalUploadException) {
            return ((FatalUploadException) error).getErrorKind();
        }
        if (error instanceof JobTimeoutException) {
            return JobErrorKind.TIMEOUT;
        }
        if (error instanceof ResourceTimeoutException) {
            return JobErrorKind.RESOURCE_TIMEOUT;
        }
        return JobErrorKind.TRANSIENT;
    }

    private StateTransitionResult scheduleRetry(UploadJob job, String message) {
        stateMachine.validate(job, JobStatus.RETRYING);
        Instant now = clock.instant();
        job.setRetryCount(job.getRetryCount() + 1);
        job.setStatus(JobStatus.RETRYING);
        job.setErrorKind(JobErrorKind.TRANSIENT);
        job.setErrorMessage(message);
        job.setAttemptToken(null);
        job.setUpdatedAt(now);
        UploadJob retrying = jobRepository.save(job);

        // RETRYING settles into PENDING right away; the dispatcher picks it up at the backoff time
        Instant next = backoffPolicy.nextAttempt(now, retrying.getId(), retrying.getRetryCount());
        retrying.setStatus(JobStatus.PENDING);
        retrying.setScheduledAt(next);
        retrying.setStartedAt(null);
        jobRepository.save(retrying);

        log.warn("Job {} failed (retry {}/{}), next attempt at {}: {}",
                job.getId(), retrying.getRetryCount(), retrying.getMaxRetries(), next, message);
        return StateTransitionResult.applied(job.getId(), JobStatus.RUNNING, JobStatus.RETRYING,
                "Next attempt at " + next);
    }

    private StateTransitionResult fail(UploadJob job, JobErrorKind kind, String message) {
        JobStatus from = job.getStatus();
        stateMachine.validate(job, JobStatus.FAILED);
        Instant now = clock.instant();
        job.setStatus(JobStatus.FAILED);
        job.setErrorKind(kind);
        job.setErrorMessage(message);
        job.setAttemptToken(null);
        job.setCompletedAt(now);
        job.setUpdatedAt(now);
        jobRepository.save(job);
        log.error("Job {} FAILED ({}): {}", job.getId(), kind, message);
        return StateTransitionResult.applied(job.getId(), from, JobStatus.FAILED, message);
    }

    private int setHeld(Long campaignId, boolean held) {
        List<UploadJob> pending = jobRepository.findByCampaignIdAndStatus(campaignId, JobStatus.PENDING);
        int changed = 0;
        for (UploadJob candidate : pending) {
            StateTransitionResult result = transition(candidate.getId(), job -> {
                if (job.getStatus() != JobStatus.PENDING || job.isHeld() == held) {
                    return StateTransitionResult.discarded(job.getId(), job.getStatus(), "Unchanged");
                }
                job.setHeld(held);
                job.setUpdatedAt(clock.instant());
                jobRepository.save(job);
                return StateTransitionResult.applied(job.getId(), JobStatus.PENDING, JobStatus.PENDING);
            });
            if (result.isApplied()) {
                changed++;
            }
        }
        log.info("{} {} pending jobs of campaign {}", held ? "Held" : "Released", changed, campaignId);
        return changed;
    }

    private boolean isCurrentAttempt(UploadJob job, String attemptToken) {
        return job.getStatus() == JobStatus.RUNNING && attemptToken != null
                && Objects.equals(job.getAttemptToken(), attemptToken);
    }

    private StateTransitionResult transition(Long jobId, Function<UploadJob, StateTransitionResult> change) {
        synchronized (lockFor(jobId)) {
            UploadJob job = jobRepository.findById(jobId)
                    .orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
            JobStatus before = job.getStatus();
            try {
                return change.apply(job);
            } catch (OptimisticLockingFailureException e) {
                log.warn("Concurrent update of job {}, discarding transition", jobId);
                return StateTransitionResult.discarded(jobId, before, "Concurrent update");
            }
        }
    }

    private Object lockFor(Long jobId) {
        return locks[Math.floorMod(jobId.hashCode(), LOCK_STRIPES)];
    }
}
