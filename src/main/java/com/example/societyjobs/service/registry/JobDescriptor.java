package com.example.societyjobs.service.registry;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runtime state of one registered job.
 * <p>
 * The running flag doubles as the run guard: it can only be taken by a
 * compare-and-set, so at most one caller holds it. Only the executor
 * mutates a descriptor; job bodies never see one.
 */
public class JobDescriptor {

    @Getter
    private final String name;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile Instant lastRun;

    public JobDescriptor(String name) {
        this.name = name;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Time of the last successful run, or null if the job has never succeeded
     */
    public Instant getLastRun() {
        return lastRun;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    /**
     * Take the run guard.
     *
     * @return false if another run of this job is still active
     */
    public boolean tryAcquire() {
        return running.compareAndSet(false, true);
    }

    public void release() {
        running.set(false);
    }

    public void recordSuccess(Instant finishedAt) {
        lastRun = finishedAt;
        consecutiveFailures.set(0);
    }

    /**
     * @return the failure count including this failure
     */
    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    void reset() {
        running.set(false);
        consecutiveFailures.set(0);
        lastRun = null;
    }
}
