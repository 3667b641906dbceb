package com.example.societyjobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack webhook used for the "retries exhausted" alert. Alerts are skipped while
 * disabled or when no webhook URL is set.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#society-jobs-alerts";
    private boolean enabled = true;

    /**
     * Base of the job API; the alert links to its status endpoint
     */
    private String dashboardBaseUrl = "http://localhost:8080/api/v1/jobs";
}
