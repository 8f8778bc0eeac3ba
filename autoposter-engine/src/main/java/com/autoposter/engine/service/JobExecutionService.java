package com.autoposter.engine.service;

import com.autoposter.engine.client.UploadClient;
import com.autoposter.engine.client.UploadResult;
import com.autoposter.engine.exception.FatalUploadException;
import com.autoposter.engine.exception.ResourceNotFoundException;
import com.autoposter.engine.exception.RetryableUploadException;
import com.autoposter.engine.model.AccountStatus;
import com.autoposter.engine.model.JobErrorKind;
import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.Proxy;
import com.autoposter.engine.model.UploadJob;
import com.autoposter.engine.repository.AccountRepository;
import com.autoposter.engine.repository.ProxyRepository;
import com.autoposter.engine.repository.UploadJobRepository;
import com.autoposter.variation.VariationEngine;
import com.autoposter.variation.VariationException;
import com.autoposter.variation.VariationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one attempt of an upload job on a worker thread: variation, uniqueness check, upload,
 * result report. The lease, the temporary variation and the in-flight entry are always
 * released, whatever the outcome.
 */
@Slf4j
@Service
public class JobExecutionService {

    private final UploadJobRepository jobRepository;
    private final AccountRepository accountRepository;
    private final ProxyRepository proxyRepository;
    private final JobLifecycleService lifecycleService;
    private final ResourceAllocator allocator;
    private final VariationEngine variationEngine;
    private final UploadClient uploadClient;
    private final Clock clock;
    private final Path workDir;
    private final int variationAttempts;
    private final UniquenessPolicy uniquenessPolicy;

    private final Map<Long, ExecutionHandle> inFlight = new ConcurrentHashMap<>();

    public JobExecutionService(UploadJobRepository jobRepository,
                               AccountRepository accountRepository,
                               ProxyRepository proxyRepository,
                               JobLifecycleService lifecycleService,
                               ResourceAllocator allocator,
                               VariationEngine variationEngine,
                               UploadClient uploadClient,
                               Clock clock,
                               @Value("${variation.work-dir:${java.io.tmpdir}/autoposter}") String workDir,
                               @Value("${variation.max-attempts:2}") int variationAttempts,
                               @Value("${variation.uniqueness-policy:ADVISORY}") UniquenessPolicy uniquenessPolicy) {
        this.jobRepository = jobRepository;
        this.accountRepository = accountRepository;
        this.proxyRepository = proxyRepository;
        this.lifecycleService = lifecycleService;
        this.allocator = allocator;
        this.variationEngine = variationEngine;
        this.uploadClient = uploadClient;
        this.clock = clock;
        this.workDir = Paths.get(workDir);
        this.variationAttempts = Math.max(1, variationAttempts);
        this.uniquenessPolicy = uniquenessPolicy;
    }

    public ExecutionHandle register(Long jobId, Lease lease) {
        ExecutionHandle handle = new ExecutionHandle(jobId, lease);
        inFlight.put(jobId, handle);
        return handle;
    }

    /**
     * Drops a registration whose attempt was never handed to a worker.
     */
    public void abandon(ExecutionHandle handle) {
        inFlight.remove(handle.getJobId(), handle);
    }

    public void execute(ExecutionHandle handle) {
        Long jobId = handle.getJobId();
        String token = handle.getAttemptToken();
        Path output = null;
        try {
            if (handle.isCancelled()) {
                log.info("Job {} cancelled before variation", jobId);
                return;
            }
            UploadJob job = jobRepository.findById(jobId)
                    .orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
            if (job.getStatus() != JobStatus.RUNNING || !token.equals(job.getAttemptToken())) {
                log.info("Job {} left attempt {} before it started ({})", jobId, token, job.getStatus());
                return;
            }

            VariationResult variation = createVariation(job, handle);
            if (variation == null) {
                log.info("Job {} cancelled during variation", jobId);
                return;
            }
            output = variation.getOutputPath();
            lifecycleService.recordVariation(jobId, token, output.toString(), variation.getContentHash());
            checkUniqueness(job, variation.getContentHash());

            if (handle.isCancelled()) {
                log.info("Job {} cancelled before upload", jobId);
                return;
            }
            Proxy proxy = job.getProxyId() == null ? null : proxyRepository.findById(job.getProxyId()).orElse(null);
            UploadResult result = uploadClient.upload(job.getAccountId(), proxy, output.toString(), job.getCaption());
            if (!result.isSuccess()) {
                throw toException(result);
            }

            if (lifecycleService.reportSuccess(jobId, token, result.getRemoteUrl()).isApplied()) {
                touchAccount(job.getAccountId());
            }
        } catch (FatalUploadException e) {
            report(handle, e);
            applyAccountSideEffect(handle.getLease().getAccountId(), e.getErrorKind());
        } catch (RuntimeException e) {
            report(handle, e);
        } finally {
            allocator.release(handle.getLease());
            inFlight.remove(jobId, handle);
            deleteQuietly(output);
        }
    }

    /**
     * Sets the cooperative cancel flag of an in-flight attempt.
     */
    public boolean cancel(Long jobId) {
        ExecutionHandle handle = inFlight.get(jobId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        log.info("Cancel requested for in-flight job {}", jobId);
        return true;
    }

    public boolean isInFlight(Long jobId) {
        return inFlight.containsKey(jobId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private VariationResult createVariation(UploadJob job, ExecutionHandle handle) {
        Path source = Paths.get(job.getVideoPath());
        VariationException last = null;
        for (int attempt = 1; attempt <= variationAttempts; attempt++) {
            try {
                return variationEngine.createJobVariation(source, job.getId(), workDir, handle::isCancelled);
            } catch (VariationException e) {
                if (e.getKind() == VariationException.Kind.CANCELLED) {
                    return null;
                }
                last = e;
                if (e.getKind() == VariationException.Kind.SOURCE_NOT_FOUND) {
                    break;
                }
                log.warn("Variation attempt {}/{} for job {} failed: {}", attempt, variationAttempts, job.getId(),
                        e.getMessage());
            }
        }
        throw new FatalUploadException("Variation failed: " + last.getMessage(), JobErrorKind.VARIATION_FAILED, last);
    }

    private void checkUniqueness(UploadJob job, String contentHash) {
        if (!jobRepository.existsByCampaignIdAndContentHashAndIdNot(job.getCampaignId(), contentHash, job.getId())) {
            return;
        }
        if (uniquenessPolicy == UniquenessPolicy.ENFORCED) {
            throw new FatalUploadException("Content hash " + contentHash + " already used in campaign "
                    + job.getCampaignId(), JobErrorKind.DUPLICATE_CONTENT);
        }
        log.warn("Job {} produced content hash {} already seen in campaign {}", job.getId(), contentHash,
                job.getCampaignId());
    }

    private RuntimeException toException(UploadResult result) {
        JobErrorKind kind = result.getErrorKind();
        String message = result.getError() == null ? "Upload rejected" : result.getError();
        if (kind == null || kind == JobErrorKind.TRANSIENT) {
            return new RetryableUploadException(message);
        }
        return new FatalUploadException(message, kind);
    }

    private void report(ExecutionHandle handle, RuntimeException error) {
        try {
            lifecycleService.reportFailure(handle.getJobId(), handle.getAttemptToken(), error);
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}", handle.getJobId(), e);
        }
    }

    private void applyAccountSideEffect(Long accountId, JobErrorKind kind) {
        AccountStatus status;
        if (kind == JobErrorKind.ACCOUNT_BANNED) {
            status = AccountStatus.BANNED;
        } else if (kind == JobErrorKind.CAPTCHA_REQUIRED) {
            status = AccountStatus.NEEDS_CAPTCHA;
        } else {
            return;
        }
        accountRepository.findById(accountId).ifPresent(account -> {
            account.setStatus(status);
            accountRepository.save(account);
            log.warn("Account {} marked {}", accountId, status);
        });
    }

    private void touchAccount(Long accountId) {
        accountRepository.findById(accountId).ifPresent(account -> {
            account.setLastUsedAt(clock.instant());
            accountRepository.save(account);
        });
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary variation {}: {}", path, e.getMessage());
        }
    }
}
