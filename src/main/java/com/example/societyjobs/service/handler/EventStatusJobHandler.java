package com.example.societyjobs.service.handler;

import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.domain.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Handler for the event-status-update job.
 * <p>
 * Moves UPCOMING events that have started to ONGOING, then every UPCOMING or ONGOING event
 * that has ended to COMPLETED. Both are set-based updates, so a second run at the same
 * instant changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventStatusJobHandler implements JobHandler {

    private final EventRepository eventRepository;
    private final Clock clock;

    @Override
    public JobType getJobType() {
        return JobType.EVENT_STATUS_UPDATE;
    }

    @Override
    public JobExecutionResult execute() {
        var now = clock.instant();

        var ongoing = eventRepository.markStarted(now);
        var completed = eventRepository.markCompleted(now);

        if (ongoing > 0 || completed > 0) {
            log.info("Event status update: {} now ongoing, {} now completed", ongoing, completed);
        }

        return JobExecutionResult.success()
                .addProcessed(ongoing + completed)
                .addSuccessful(ongoing + completed)
                .withDetail("ongoing", ongoing)
                .withDetail("completed", completed);
    }
}
