package com.example.societyjobs.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Blob storage service configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "external-services.storage-service")
public class StorageServiceProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 15;
    private String resourceType = "raw";
}
