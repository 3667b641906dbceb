package com.example.societyjobs.service.handler;

import com.example.societyjobs.config.JobEngineProperties;
import com.example.societyjobs.config.JobEngineProperties.ReminderThreshold;
import com.example.societyjobs.domain.entity.Event;
import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.domain.repository.EventRepository;
import com.example.societyjobs.service.cache.ReminderDedupCache;
import com.example.societyjobs.service.notification.NotificationDispatcher;
import com.example.societyjobs.service.notification.NotificationRequest;
import com.example.societyjobs.service.notification.RecipientResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Handler for the event-reminders job.
 * <p>
 * For every upcoming event inside the look-ahead window, a threshold {@code t} fires when
 * the minutes left until start fall in {@code (t - pollingInterval, t]}. Since the job runs
 * every pollingInterval minutes, each threshold is crossed in exactly one scan; the dedup
 * cache absorbs repeated scans inside the same window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventReminderJobHandler implements JobHandler {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final EventRepository eventRepository;
    private final ReminderDedupCache reminderDedupCache;
    private final RecipientResolver recipientResolver;
    private final NotificationDispatcher notificationDispatcher;
    private final JobEngineProperties properties;
    private final Clock clock;

    @Override
    public JobType getJobType() {
        return JobType.EVENT_REMINDERS;
    }

    @Override
    public JobExecutionResult execute() {
        var settings = properties.getReminders();
        var now = clock.instant();
        var until = now.plus(Duration.ofHours(settings.getLookAheadHours()));
        var ttl = Duration.ofMinutes(settings.getCacheTtlMinutes());
        var zone = ZoneId.of(settings.getZoneId());
        var result = JobExecutionResult.success();

        var events = eventRepository.findUpcomingStartingBetween(now, until);
        var remindersSent = 0;

        for (var event : events) {
            var diffMinutes = Duration.between(now, event.getStartsAt()).toMinutes();

            for (var threshold : settings.getThresholds()) {
                if (!inWindow(diffMinutes, threshold.getMinutesBeforeStart(), settings.getPollingIntervalMinutes())) {
                    continue;
                }

                var key = ReminderDedupCache.key(event.getId(), threshold.getMinutesBeforeStart());
                if (!reminderDedupCache.markIfAbsent(key, ttl)) {
                    log.debug("Reminder {} already sent", key);
                    continue;
                }

                result.addProcessed(1);
                if (sendReminder(event, threshold, zone, result)) {
                    result.addSuccessful(1);
                    remindersSent++;
                }
            }
        }

        return result
                .withDetail("eventsScanned", events.size())
                .withDetail("remindersSent", remindersSent);
    }

    static boolean inWindow(long diffMinutes, int thresholdMinutes, int windowMinutes) {
        return diffMinutes <= thresholdMinutes && diffMinutes > thresholdMinutes - windowMinutes;
    }

    /**
     * @return false if the dispatch failed; the failure is added to the result
     */
    private boolean sendReminder(Event event, ReminderThreshold threshold, ZoneId zone, JobExecutionResult result) {
        try {
            var recipients = recipientResolver.registrantsOf(event.getId());
            if (recipients.isEmpty()) {
                log.debug("No registrants for event {}, '{}' reminder marked without dispatch", event.getId(), threshold.getLabel());
                return true;
            }

            var time = TIME_FORMAT.format(event.getStartsAt().atZone(zone));
            var outcome = notificationDispatcher.dispatch(NotificationRequest.forEvent(event.getId())
                    .title("Event Reminder: " + event.getTitle())
                    .description(threshold.render(event.getTitle(), time))
                    .image(event.getBanner())
                    .recipients(recipients)
                    .build());

            if (outcome.isFailed()) {
                log.warn("Failed to send '{}' reminder for event {}: {}", threshold.getLabel(), event.getId(), outcome.getErrorMessage());
                result.addError("event " + event.getId() + " reminder " + threshold.getMinutesBeforeStart() + ": " + outcome.getErrorMessage());
                return false;
            }

            log.info("Sent '{}' reminder for event '{}' to {} participants", threshold.getLabel(), event.getTitle(), recipients.size());
            return true;
        } catch (Exception e) {
            log.error("Error sending '{}' reminder for event {}: {}", threshold.getLabel(), event.getId(), e.getMessage());
            result.addError("event " + event.getId() + " reminder " + threshold.getMinutesBeforeStart() + ": " + e.getMessage());
            return false;
        }
    }
}
