package com.example.societyjobs.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the background job engine.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-engine")
public class JobEngineProperties {

    /**
     * Maximum consecutive failures before automatic retries stop
     */
    @Min(1)
    private int defaultMaxRetries = 3;

    /**
     * Fixed delay in milliseconds before a failed job is retried
     */
    @Min(0)
    private long retryDelayMs = 30000;

    /**
     * Number of threads available to trigger clocks and retries
     */
    @Min(1)
    private int schedulerPoolSize = 4;

    @Valid
    private Cleanup cleanup = new Cleanup();

    @Valid
    private Publishing publishing = new Publishing();

    @Valid
    private Reminders reminders = new Reminders();

    @Valid
    private Notifications notifications = new Notifications();

    @Data
    public static class Cleanup {

        /**
         * Age in days after which processed join requests and finished meetings are purged
         */
        @Min(1)
        private int retentionDays = 30;

        /**
         * Rows fetched and deleted per batch
         */
        @Min(1)
        private int batchSize = 1000;

        /**
         * Maximum blob deletions in flight at any time
         */
        @Min(1)
        private int maxConcurrentDeletes = 5;

        /**
         * Pause between blob deletion chunks
         */
        @Min(0)
        private long chunkPauseMs = 200;

        /**
         * Age in days after which unused push tokens are purged
         */
        @Min(1)
        private int pushTokenRetentionDays = 30;
    }

    @Data
    public static class Publishing {

        /**
         * Maximum items of each kind published per run
         */
        @Min(1)
        private int batchSize = 100;
    }

    @Data
    public static class Reminders {

        /**
         * How far ahead upcoming events are scanned
         */
        @Min(1)
        private int lookAheadHours = 24;

        /**
         * Reminder trigger period; also the width of each threshold window
         */
        @Min(1)
        private int pollingIntervalMinutes = 10;

        /**
         * Lifetime of a "reminder sent" marker
         */
        @Min(1)
        private int cacheTtlMinutes = 120;

        /**
         * Zone used to render the event start time in reminder messages
         */
        @NotBlank
        private String zoneId = "UTC";

        @Valid
        @NotEmpty
        private List<ReminderThreshold> thresholds = new ArrayList<>(defaultThresholds());
    }

    @Data
    public static class Notifications {

        /**
         * Worker threads for background push delivery
         */
        @Min(1)
        private int pushPoolSize = 4;

        /**
         * Pending push deliveries accepted before new ones are rejected
         */
        @Min(1)
        private int pushQueueCapacity = 500;
    }

    /**
     * A point before event start at which a reminder is sent.
     * Templates may use the {title} and {time} placeholders.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReminderThreshold {

        @Min(1)
        private int minutesBeforeStart;

        @NotBlank
        private String label;

        @NotBlank
        private String messageTemplate;

        public String render(String title, String time) {
            return messageTemplate.replace("{title}", title).replace("{time}", time);
        }
    }

    static List<ReminderThreshold> defaultThresholds() {
        return List.of(
                new ReminderThreshold(1440, "1 day", "Reminder: The event '{title}' is happening tomorrow at {time}."),
                new ReminderThreshold(720, "12 hours", "Reminder: The event '{title}' starts in 12 hours at {time}."),
                new ReminderThreshold(180, "3 hours", "Reminder: The event '{title}' starts in 3 hours at {time}."),
                new ReminderThreshold(60, "1 hour", "Reminder: The event '{title}' starts in 1 hour at {time}."),
                new ReminderThreshold(15, "15 minutes", "Reminder: The event '{title}' starts in 15 minutes at {time}."),
                new ReminderThreshold(5, "5 minutes", "Reminder: The event '{title}' starts in 5 minutes at {time}.")
        );
    }
}
