package com.example.societyjobs.service.handler;

import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.service.cache.ReminderDedupCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handler for the reminder-cache-sweep job. Drops expired reminder markers
 * so the cache does not hold entries for events nobody looks up again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderCacheSweepJobHandler implements JobHandler {

    private final ReminderDedupCache reminderDedupCache;

    @Override
    public JobType getJobType() {
        return JobType.REMINDER_CACHE_SWEEP;
    }

    @Override
    public JobExecutionResult execute() {
        var removed = reminderDedupCache.sweepExpired();
        log.debug("Reminder cache sweep removed {} entries, {} remain", removed, reminderDedupCache.size());

        return JobExecutionResult.success()
                .addProcessed(removed)
                .addSuccessful(removed)
                .withDetail("remaining", reminderDedupCache.size());
    }
}
