package com.example.societyjobs.config;

import com.example.societyjobs.domain.enums.JobRunOutcome;
import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.service.cache.ReminderDedupCache;
import com.example.societyjobs.service.registry.JobRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for monitoring job engine health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job run durations by outcome
 * - Skipped runs, retries and exhausted retries
 * - Item-level errors
 * - Background push dispatch failures
 * - Running flags and dedup cache size
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobRegistry jobRegistry;
    private final ReminderDedupCache reminderDedupCache;

    @PostConstruct
    public void initializeMetrics() {
        for (var type : JobType.values()) {
            var name = type.getCode();
            Gauge.builder("society_jobs_job_running", jobRegistry,
                            registry -> registry.find(name).map(d -> d.isRunning() ? 1.0 : 0.0).orElse(0.0))
                    .tag("job", name)
                    .description("1 while the job body is executing")
                    .register(meterRegistry);

            Gauge.builder("society_jobs_consecutive_failures", jobRegistry,
                            registry -> registry.find(name).map(d -> (double) d.getConsecutiveFailures()).orElse(0.0))
                    .tag("job", name)
                    .description("Consecutive failed runs of the job")
                    .register(meterRegistry);
        }

        Gauge.builder("society_jobs_reminder_cache_size", reminderDedupCache, ReminderDedupCache::size)
                .description("Reminder markers held in the dedup cache")
                .register(meterRegistry);
    }

    /**
     * Create a timer for a job run
     */
    public Timer.Sample startJobTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job run time
     */
    public void recordJobExecution(Timer.Sample sample, String jobName, JobRunOutcome outcome) {
        sample.stop(Timer.builder("society_jobs_execution_time")
                .tag("job", jobName)
                .tag("outcome", outcome.name().toLowerCase())
                .description("Job run time")
                .register(meterRegistry));
    }

    public void recordJobSkipped(String jobName) {
        meterRegistry.counter("society_jobs_skipped", "job", jobName).increment();
    }

    public void recordJobFailure(String jobName, String errorType) {
        meterRegistry.counter("society_jobs_failures",
                "job", jobName,
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordRetry(String jobName, int attemptNumber) {
        meterRegistry.counter("society_jobs_retries",
                "job", jobName,
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordRetriesExhausted(String jobName) {
        meterRegistry.counter("society_jobs_retries_exhausted", "job", jobName).increment();
    }

    public void recordItemErrors(String jobName, int count) {
        meterRegistry.counter("society_jobs_item_errors", "job", jobName).increment(count);
    }

    public void recordBackgroundDispatchFailure(String reason) {
        meterRegistry.counter("society_jobs_background_dispatch_failures", "reason", reason).increment();
    }
}
