package com.example.societyjobs.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "external-services.notification-service")
public class NotificationServiceProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 30;
}
