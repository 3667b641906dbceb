package com.example.societyjobs.service.executor;

import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.exception.JobNotRegisteredException;
import com.example.societyjobs.service.handler.JobExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Clocks that fire the recurring jobs.
 * <p>
 * Triggers are independent and may overlap each other or a retry of the same job;
 * the run guard inside {@link JobExecutorService} decides whether a firing does any work.
 * No exception escapes a trigger, so a failing job never stops its clock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobTriggerService {

    private final JobExecutorService jobExecutorService;

    @Scheduled(cron = "${job-engine.triggers.cache-sweep-cron:0 0 * * * *}")
    public void sweepReminderCache() {
        fire(JobType.REMINDER_CACHE_SWEEP);
    }

    @Scheduled(cron = "${job-engine.triggers.cleanup-cron:0 0 0 * * *}")
    public void cleanupStaleRecords() {
        fire(JobType.STALE_RECORD_CLEANUP);
    }

    @Scheduled(cron = "${job-engine.triggers.publishing-cron:0 */5 * * * *}")
    public void publishScheduledContent() {
        fire(JobType.SCHEDULED_PUBLISHING);
    }

    @Scheduled(cron = "${job-engine.triggers.status-cron:0 */5 * * * *}")
    public void updateEventStatuses() {
        fire(JobType.EVENT_STATUS_UPDATE);
    }

    /**
     * Period equals the reminder window width, so every threshold crossing falls into exactly one scan.
     */
    @Scheduled(fixedRateString = "${job-engine.reminders.polling-interval-minutes:10}", timeUnit = TimeUnit.MINUTES)
    public void sendEventReminders() {
        fire(JobType.EVENT_REMINDERS);
    }

    JobExecutionResult fire(JobType jobType) {
        var jobName = jobType.getCode();
        log.debug("Trigger fired for job {}", jobName);
        try {
            return jobExecutorService.executeRegistered(jobName);
        } catch (JobNotRegisteredException e) {
            // registry is emptied on shutdown while the scheduler drains
            log.info("Job {} is not registered, trigger ignored", jobName);
            return JobExecutionResult.failure(jobName, e);
        } catch (Exception e) {
            log.error("Trigger for job {} failed: {}", jobName, e.getMessage(), e);
            return JobExecutionResult.failure(jobName, e);
        }
    }
}
