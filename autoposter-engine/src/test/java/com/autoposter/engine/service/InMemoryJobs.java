package com.autoposter.engine.service;

import com.autoposter.engine.model.JobStatus;
import com.autoposter.engine.model.UploadJob;
import com.autoposter.engine.repository.UploadJobRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;

/**
 * Backs a mocked {@link UploadJobRepository} with a map so lifecycle and dispatch tests see
 * their own writes.
 */
class InMemoryJobs {

    final Map<Long, UploadJob> store = new ConcurrentHashMap<>();

    InMemoryJobs(UploadJobRepository repository) {
        lenient().when(repository.findById(anyLong())).thenAnswer(inv -> Optional.ofNullable(store.get(inv.<Long>getArgument(0))));
        lenient().when(repository.save(any(UploadJob.class))).thenAnswer(inv -> {
            UploadJob job = inv.getArgument(0);
            store.put(job.getId(), job);
            return job;
        });
        lenient().when(repository.findByStatusAndHeldFalseAndScheduledAtLessThanEqualOrderByScheduledAtAscIdAsc(any(), any()))
                .thenAnswer(inv -> select(inv.getArgument(0), inv.getArgument(1), true));
        lenient().when(repository.findByStatusAndHeldFalseAndScheduledAtBefore(any(), any()))
                .thenAnswer(inv -> select(inv.getArgument(0), inv.<Instant>getArgument(1).minusNanos(1), true));
        lenient().when(repository.findByStatusAndStartedAtBefore(any(), any()))
                .thenAnswer(inv -> store.values().stream()
                        .filter(j -> j.getStatus() == inv.getArgument(0))
                        .filter(j -> j.getStartedAt() != null && j.getStartedAt().isBefore(inv.getArgument(1)))
                        .collect(Collectors.toList()));
        lenient().when(repository.findByCampaignIdAndStatus(any(), any()))
                .thenAnswer(inv -> store.values().stream()
                        .filter(j -> j.getCampaignId().equals(inv.getArgument(0)) && j.getStatus() == inv.getArgument(1))
                        .sorted(Comparator.comparing(UploadJob::getId))
                        .collect(Collectors.toList()));
    }

    UploadJob put(UploadJob job) {
        store.put(job.getId(), job);
        return job;
    }

    UploadJob get(long id) {
        return store.get(id);
    }

    private List<UploadJob> select(JobStatus status, Instant notAfter, boolean notHeld) {
        return store.values().stream()
                .filter(j -> j.getStatus() == status)
                .filter(j -> !notHeld || !j.isHeld())
                .filter(j -> !j.getScheduledAt().isAfter(notAfter))
                .sorted(Comparator.comparing(UploadJob::getScheduledAt).thenComparing(UploadJob::getId))
                .collect(Collectors.toList());
    }
}
