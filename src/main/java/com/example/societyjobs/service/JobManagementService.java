package com.example.societyjobs.service;

import com.example.societyjobs.dto.JobRunResponse;
import com.example.societyjobs.dto.JobStatusResponse;
import com.example.societyjobs.mapper.JobMapper;
import com.example.societyjobs.service.cache.ReminderDedupCache;
import com.example.societyjobs.service.executor.JobExecutorService;
import com.example.societyjobs.service.handler.JobHandlerRegistry;
import com.example.societyjobs.service.registry.JobRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Service for job engine lifecycle and monitoring operations.
 * <p>
 * Provides:
 * - Startup registration of every handled job and cache initialization
 * - Shutdown of the cache and registry
 * - Status snapshots
 * - Manual job runs
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    private final JobRegistry jobRegistry;
    private final JobHandlerRegistry handlerRegistry;
    private final ReminderDedupCache reminderDedupCache;
    private final JobExecutorService jobExecutorService;
    private final JobMapper jobMapper;
    private final Clock clock;

    private Instant startedAt;

    /**
     * Runs before the scheduler starts firing triggers.
     */
    @PostConstruct
    public void initializeJobs() {
        startedAt = clock.instant();
        reminderDedupCache.init();
        handlerRegistry.getHandlers().forEach(handler -> jobRegistry.register(handler.getJobName()));
        log.info("Job engine initialized with {} jobs", jobRegistry.size());
    }

    @PreDestroy
    public void shutdownJobs() {
        log.info("Shutting down job engine");
        reminderDedupCache.shutdown();
        jobRegistry.clear();
    }

    public JobStatusResponse getJobStatuses() {
        var now = clock.instant();
        return JobStatusResponse.builder()
                .jobs(jobMapper.toResponseList(jobRegistry.getAll()))
                .reminderCacheSize(reminderDedupCache.size())
                .uptimeMs(startedAt != null ? Duration.between(startedAt, now).toMillis() : 0L)
                .generatedAt(now)
                .build();
    }

    /**
     * Run a job now, on the caller's thread, under the same guard and retry policy as its trigger.
     *
     * @throws com.example.societyjobs.exception.JobNotRegisteredException if no such job exists
     */
    public JobRunResponse executeJobManually(String jobName) {
        log.info("Manual run requested for job {}", jobName);
        var result = jobExecutorService.executeRegistered(jobName);
        return jobMapper.toRunResponse(result);
    }
}
