package com.autoposter.engine.service;

import com.autoposter.engine.exception.ResourceBusyException;
import com.autoposter.engine.model.UploadJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Lease table keyed by account id. Acquire and release are single atomic map operations,
 * so at most one lease per account exists at any instant.
 */
@Slf4j
@Service
public class ResourceAllocator {

    private final ConcurrentMap<Long, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration leaseDuration;

    public ResourceAllocator(Clock clock, @Value("${dispatcher.job-hard-timeout:PT30M}") Duration leaseDuration) {
        this.clock = clock;
        this.leaseDuration = leaseDuration;
    }

    public Optional<Lease> tryAcquire(UploadJob job) {
        Instant now = clock.instant();
        Lease candidate = new Lease(job.getAccountId(), job.getProxyId(), job.getId(), job.getCampaignId(),
                UUID.randomUUID().toString(), now, now.plus(leaseDuration));

        Lease holder = leases.putIfAbsent(job.getAccountId(), candidate);
        if (holder != null) {
            log.debug("Account {} busy: job {} holds it, job {} waits", job.getAccountId(), holder.getJobId(), job.getId());
            return Optional.empty();
        }
        log.debug("Leased account {} to job {}", job.getAccountId(), job.getId());
        return Optional.of(candidate);
    }

    public Lease acquire(UploadJob job) {
        return tryAcquire(job).orElseThrow(() -> {
            Lease holder = leases.get(job.getAccountId());
            return new ResourceBusyException(job.getAccountId(), holder == null ? null : holder.getJobId());
        });
    }

    /**
     * Releases the lease if it is still the live one. Releasing twice, or releasing a lease
     * that was revoked and handed to another job, does nothing.
     */
    public boolean release(Lease lease) {
        if (lease == null) {
            return false;
        }
        boolean released = leases.remove(lease.getAccountId(), lease);
        if (released) {
            log.debug("Released account {} from job {}", lease.getAccountId(), lease.getJobId());
        }
        return released;
    }

    /**
     * Forcibly drops the lease on the account if {@code jobId} still holds it, whatever its token.
     */
    public Optional<Lease> revoke(Long accountId, Long jobId) {
        Lease[] revoked = new Lease[1];
        leases.computeIfPresent(accountId, (key, lease) -> {
            if (Objects.equals(lease.getJobId(), jobId)) {
                revoked[0] = lease;
                return null;
            }
            return lease;
        });
        if (revoked[0] != null) {
            log.warn("Revoked lease on account {} held by job {}", accountId, jobId);
        }
        return Optional.ofNullable(revoked[0]);
    }

    public Optional<Lease> holder(Long accountId) {
        return Optional.ofNullable(leases.get(accountId));
    }

    public boolean isLeased(Long accountId) {
        return leases.containsKey(accountId);
    }

    public boolean isLeasedByOtherCampaign(Long accountId, Long campaignId) {
        Lease lease = leases.get(accountId);
        return lease != null && !Objects.equals(lease.getCampaignId(), campaignId);
    }

    public List<Lease> activeLeases() {
        return List.copyOf(leases.values());
    }
}
