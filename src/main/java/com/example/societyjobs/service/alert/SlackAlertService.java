package com.example.societyjobs.service.alert;

import com.example.societyjobs.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Service for sending alerts to Slack when a job stops retrying.
 * <p>
 * The engine runs unattended, so this and the metrics are the only
 * places a persistent job failure becomes visible to an operator.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:society-jobs}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert for a job whose automatic retries are exhausted.
     * Runs asynchronously to not block the trigger thread.
     */
    @Async
    public void sendRetriesExhaustedAlert(String jobName, int consecutiveFailures, Instant lastSuccess, String errorMessage) {
        if (!slackProperties.isEnabled() || slackProperties.getWebhookUrl() == null || slackProperties.getWebhookUrl().isBlank()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {} exhausted its retries but no alert was sent.", jobName);
            return;
        }

        try {
            var payload = buildRetriesExhaustedPayload(jobName, consecutiveFailures, lastSuccess, errorMessage);
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for job {} retries exhausted", jobName);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", jobName, e.getMessage(), e);
        }
    }

    private Payload buildRetriesExhaustedPayload(String jobName, int consecutiveFailures, Instant lastSuccess, String errorMessage) {
        var lastError = errorMessage != null ? errorMessage : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Background Job Failing - Retries Exhausted*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(jobName)
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/status")
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job")
                                                .value(jobName)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Consecutive Failures")
                                                .value(String.valueOf(consecutiveFailures))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Success")
                                                .value(lastSuccess != null ? DATE_FORMATTER.format(lastSuccess) : "never")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Next attempt on the job's regular schedule")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
