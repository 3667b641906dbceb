package com.example.societyjobs.service.executor;

import com.example.societyjobs.config.JobEngineProperties;
import com.example.societyjobs.config.MetricsConfig;
import com.example.societyjobs.domain.enums.JobRunOutcome;
import com.example.societyjobs.exception.JobNotRegisteredException;
import com.example.societyjobs.service.alert.SlackAlertService;
import com.example.societyjobs.service.handler.JobExecutionResult;
import com.example.societyjobs.service.handler.JobHandlerRegistry;
import com.example.societyjobs.service.registry.JobDescriptor;
import com.example.societyjobs.service.registry.JobRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Service responsible for running a job body under its run guard.
 * <p>
 * Handles:
 * - Run guard acquisition and release
 * - Timing and structured logging
 * - Failure counting and bounded retry scheduling
 * - Metrics recording
 * - Alert triggering once retries are exhausted
 */
@Slf4j
@Service
public class JobExecutorService {

    private final JobRegistry jobRegistry;
    private final JobHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final JobEngineProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public JobExecutorService(JobRegistry jobRegistry, JobHandlerRegistry handlerRegistry, SlackAlertService slackAlertService,
                              MetricsConfig metricsConfig, JobEngineProperties properties,
                              @Qualifier("taskScheduler") TaskScheduler taskScheduler, Clock clock) {
        this.jobRegistry = jobRegistry;
        this.handlerRegistry = handlerRegistry;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Run the registered handler of a job with the default retry budget.
     *
     * @throws com.example.societyjobs.exception.JobNotRegisteredException if the job or its handler is unknown
     */
    public JobExecutionResult executeRegistered(String jobName) {
        var handler = handlerRegistry.getHandlerOrThrow(jobName);
        return execute(jobName, handler::execute, properties.getDefaultMaxRetries());
    }

    /**
     * Run a job body with full lifecycle management.
     * <p>
     * A run that finds the job already running is skipped. A failed run is retried after
     * the configured delay while the consecutive failure count stays below {@code maxRetries};
     * the retry goes through this method again and so is guarded like any other run.
     *
     * @param jobName    registered job name
     * @param body       the work to run
     * @param maxRetries consecutive failures after which automatic retries stop
     * @return the run result; never null
     * @throws com.example.societyjobs.exception.JobNotRegisteredException if the job was never registered
     */
    public JobExecutionResult execute(String jobName, JobBody body, int maxRetries) {
        var descriptor = jobRegistry.getOrThrow(jobName);

        if (!descriptor.tryAcquire()) {
            log.info("Job {} is still running, skipping this run", jobName);
            metricsConfig.recordJobSkipped(jobName);
            return JobExecutionResult.skipped(jobName);
        }

        log.info("Starting job {}", jobName);
        var timerSample = metricsConfig.startJobTimer();
        var startTime = clock.instant();

        JobExecutionResult result;
        var failures = 0;
        try {
            result = body.run();
            if (result == null) {
                result = JobExecutionResult.success();
            }
            result.setJobName(jobName);
            result.setOutcome(JobRunOutcome.COMPLETED);
            result.setDurationMs(elapsedMs(startTime));
            descriptor.recordSuccess(clock.instant());
        } catch (Exception e) {
            result = JobExecutionResult.failure(jobName, e);
            result.setDurationMs(elapsedMs(startTime));
            failures = descriptor.recordFailure();
            log.error("Job {} failed after {}ms (consecutive failures: {}): {}",
                    jobName, result.getDurationMs(), failures, result.getErrorMessage(), e);
        } finally {
            descriptor.release();
        }

        metricsConfig.recordJobExecution(timerSample, jobName, result.getOutcome());

        if (!result.isFailed()) {
            handleSuccess(result);
            return result;
        }

        metricsConfig.recordJobFailure(jobName, result.getErrorType());
        handleFailure(descriptor, body, maxRetries, failures, result);
        return result;
    }

    private void handleSuccess(JobExecutionResult result) {
        if (result.hasErrors()) {
            metricsConfig.recordItemErrors(result.getJobName(), result.getErrors().size());
            log.warn("Job {} completed in {}ms with {} item errors (processed: {}, successful: {})",
                    result.getJobName(), result.getDurationMs(), result.getErrors().size(),
                    result.getTotalProcessed(), result.getSuccessful());
            result.getErrors().forEach(error -> log.debug("Job {} item error: {}", result.getJobName(), error));
        } else {
            log.info("Job {} completed in {}ms (processed: {}, successful: {})",
                    result.getJobName(), result.getDurationMs(), result.getTotalProcessed(), result.getSuccessful());
        }
    }

    private void handleFailure(JobDescriptor descriptor, JobBody body, int maxRetries, int failures, JobExecutionResult result) {
        var jobName = descriptor.getName();

        if (failures < maxRetries) {
            scheduleRetry(jobName, body, maxRetries, failures);
            return;
        }

        log.error("Job {} exceeded max retries ({}), waiting for its next regular trigger", jobName, maxRetries);
        metricsConfig.recordRetriesExhausted(jobName);
        slackAlertService.sendRetriesExhaustedAlert(jobName, failures, descriptor.getLastRun(), result.getErrorMessage());
    }

    private void scheduleRetry(String jobName, JobBody body, int maxRetries, int failures) {
        var delay = Duration.ofMillis(properties.getRetryDelayMs());
        var retryAt = clock.instant().plus(delay);

        log.info("Scheduling retry {} of job {} at {}", failures, jobName, retryAt);
        metricsConfig.recordRetry(jobName, failures);

        taskScheduler.schedule(() -> {
            try {
                execute(jobName, body, maxRetries);
            } catch (JobNotRegisteredException e) {
                log.info("Job {} was unregistered before its retry ran, retry dropped", jobName);
            } catch (Exception e) {
                log.error("Retry of job {} could not run: {}", jobName, e.getMessage(), e);
            }
        }, retryAt);
    }

    private long elapsedMs(Instant startTime) {
        return Duration.between(startTime, clock.instant()).toMillis();
    }
}
