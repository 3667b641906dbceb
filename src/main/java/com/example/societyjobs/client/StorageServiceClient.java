package com.example.societyjobs.client;

import com.example.societyjobs.client.ClientModels.DestroyResourceRequest;
import com.example.societyjobs.client.ClientModels.DestroyResourceResponse;
import com.example.societyjobs.config.StorageServiceProperties;
import com.example.societyjobs.exception.ExternalServiceException;
import com.example.societyjobs.service.storage.BlobDeletionTransport;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Client for the blob storage service.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff
 * - WebClient for HTTP calls
 */
@Slf4j
@Component
public class StorageServiceClient implements BlobDeletionTransport {

    private static final Pattern PUBLIC_ID_PATTERN = Pattern.compile("/upload/(?:v\\d+/)?(.+?)(\\.[a-z]+)?$");

    private final WebClient webClient;
    private final StorageServiceProperties properties;

    public StorageServiceClient(@Qualifier("storageServiceWebClient") WebClient webClient, StorageServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Public id of a stored resource, i.e. the path after {@code /upload/} without the
     * optional version segment and file extension.
     */
    static Optional<String> extractPublicId(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        var matcher = PUBLIC_ID_PATTERN.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Delete a blob by URL
     *
     * @return true if the store reports the resource removed; false for an unusable URL
     * @throws ExternalServiceException if the API call fails
     */
    @Override
    @CircuitBreaker(name = "storageService", fallbackMethod = "deleteBlobFallback")
    @Retry(name = "storageService")
    public boolean deleteBlob(String url) {
        var publicId = extractPublicId(url).orElse(null);
        if (publicId == null) {
            log.warn("Invalid blob URL, could not extract public id: {}", url);
            return false;
        }

        log.debug("Calling Storage Service to destroy resource: {}", publicId);

        try {
            var response = webClient.post()
                    .uri("/api/v1/resources/destroy")
                    .bodyValue(DestroyResourceRequest.builder()
                            .publicId(publicId)
                            .resourceType(properties.getResourceType())
                            .build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException("Storage Service", clientResponse.statusCode().value(), body))))
                    .bodyToMono(DestroyResourceResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();

            var deleted = response != null && "ok".equalsIgnoreCase(response.getResult());
            if (!deleted) {
                log.warn("Storage Service did not delete resource {}: {}", publicId, response != null ? response.getResult() : "empty response");
            }
            return deleted;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to destroy resource {}: {}", publicId, e.getMessage());
            throw new ExternalServiceException("Storage Service", e);
        }
    }

    /**
     * Fallback for an open circuit only; failed calls keep their own exception and status
     */
    @SuppressWarnings("unused")
    private boolean deleteBlobFallback(String url, CallNotPermittedException e) {
        log.warn("Circuit breaker open for Storage Service, url: {}, error: {}", url, e.getMessage());
        throw new ExternalServiceException("Storage Service", "Service temporarily unavailable (circuit breaker open)", e);
    }
}
