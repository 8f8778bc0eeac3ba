package com.autoposter.engine.service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of execution slots in front of an executor. The dispatcher reserves a slot
 * before it leases anything, so a hand-off never blocks and never gets rejected.
 */
@Slf4j
public class WorkerPool {

    private final ExecutorService executor;
    private final int size;
    private final AtomicInteger inFlight = new AtomicInteger();

    public WorkerPool(int size) {
        this(Executors.newFixedThreadPool(size, namedThreads("upload-worker-")), size);
    }

    public WorkerPool(ExecutorService executor, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Worker pool size must be positive, got " + size);
        }
        this.executor = executor;
        this.size = size;
    }

    public boolean tryReserve() {
        while (true) {
            int current = inFlight.get();
            if (current >= size) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void cancelReservation() {
        inFlight.decrementAndGet();
    }

    /**
     * Runs the task on a slot previously obtained from {@link #tryReserve()}. The slot is
     * freed when the task ends.
     */
    public void submitReserved(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Worker task failed", e);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            throw e;
        }
    }

    public int freeSlots() {
        return Math.max(0, size - inFlight.get());
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int size() {
        return size;
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers still busy after 30s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
