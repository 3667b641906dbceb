package com.example.societyjobs.service.handler;

import com.example.societyjobs.config.JobEngineProperties;
import com.example.societyjobs.domain.entity.Announcement;
import com.example.societyjobs.domain.entity.Event;
import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.domain.enums.Visibility;
import com.example.societyjobs.domain.repository.AnnouncementRepository;
import com.example.societyjobs.domain.repository.EventRepository;
import com.example.societyjobs.service.notification.NotificationDispatcher;
import com.example.societyjobs.service.notification.NotificationRequest;
import com.example.societyjobs.service.notification.RecipientResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Handler for the scheduled-publishing job.
 * <p>
 * Publishes events and announcements whose publish time has passed and notifies their audience.
 * Each item is saved on its own, so one bad item never rolls back or blocks the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledPublishingJobHandler implements JobHandler {

    private final EventRepository eventRepository;
    private final AnnouncementRepository announcementRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final RecipientResolver recipientResolver;
    private final JobEngineProperties properties;
    private final Clock clock;

    @Override
    public JobType getJobType() {
        return JobType.SCHEDULED_PUBLISHING;
    }

    @Override
    public JobExecutionResult execute() {
        var now = clock.instant();
        var limit = properties.getPublishing().getBatchSize();
        var result = JobExecutionResult.success();

        var events = eventRepository.findDueForPublishing(now, limit);
        var publishedEvents = 0;
        for (var event : events) {
            result.addProcessed(1);
            if (publishItem("event", event.getId(), result, () -> publishEvent(event))) {
                publishedEvents++;
            }
        }

        var announcements = announcementRepository.findDueForPublishing(now, limit);
        var publishedAnnouncements = 0;
        for (var announcement : announcements) {
            result.addProcessed(1);
            if (publishItem("announcement", announcement.getId(), result, () -> publishAnnouncement(announcement))) {
                publishedAnnouncements++;
            }
        }

        if (publishedEvents > 0 || publishedAnnouncements > 0) {
            log.info("Published {} scheduled events and {} scheduled announcements", publishedEvents, publishedAnnouncements);
        }
        return result
                .withDetail("eventsPublished", publishedEvents)
                .withDetail("announcementsPublished", publishedAnnouncements);
    }

    /**
     * @return true if the item was flipped to PUBLISH, even when its notification failed
     */
    private boolean publishItem(String kind, UUID id, JobExecutionResult result, ItemPublisher publisher) {
        try {
            var error = publisher.publish();
            if (error == null) {
                result.addSuccessful(1);
            } else {
                log.warn("Published {} {} but its notification failed: {}", kind, id, error);
                result.addError(kind + " " + id + ": " + error);
            }
            return true;
        } catch (Exception e) {
            log.error("Failed to publish {} {}: {}", kind, id, e.getMessage());
            result.addError(kind + " " + id + ": " + e.getMessage());
            return false;
        }
    }

    private String publishEvent(Event event) {
        event.setVisibility(Visibility.PUBLISH);
        eventRepository.save(event);

        var recipients = recipientResolver.forAudience(event.getSocietyId(), event.getAudience());
        if (recipients.isEmpty()) {
            log.debug("Event {} published with no one to notify (audience {})", event.getId(), event.getAudience());
            return null;
        }

        var outcome = notificationDispatcher.dispatch(NotificationRequest.forEvent(event.getId())
                .title("New Event: " + event.getTitle())
                .description("A new event \"" + event.getTitle() + "\" has been published")
                .image(event.getBanner())
                .recipients(recipients)
                .build());
        return outcome.isFailed() ? outcome.getErrorMessage() : null;
    }

    private String publishAnnouncement(Announcement announcement) {
        announcement.setStatus(Visibility.PUBLISH);
        announcementRepository.save(announcement);

        var recipients = recipientResolver.forAudience(announcement.getSocietyId(), announcement.getAudience());
        if (recipients.isEmpty()) {
            return null;
        }

        var outcome = notificationDispatcher.dispatch(NotificationRequest.builder()
                .title(announcement.getTitle())
                .description(announcement.getContent())
                .recipients(recipients)
                .sendEmail(announcement.isSendEmail())
                .build());
        return outcome.isFailed() ? outcome.getErrorMessage() : null;
    }

    /**
     * Publishes one item; returns a notification error message or null
     */
    @FunctionalInterface
    private interface ItemPublisher {
        String publish();
    }
}
