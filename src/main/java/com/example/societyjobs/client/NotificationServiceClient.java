package com.example.societyjobs.client;

import com.example.societyjobs.client.ClientModels.CreateNotificationRequest;
import com.example.societyjobs.client.ClientModels.CreateNotificationResponse;
import com.example.societyjobs.client.ClientModels.PushRequest;
import com.example.societyjobs.client.ClientModels.PushResponse;
import com.example.societyjobs.config.NotificationServiceProperties;
import com.example.societyjobs.exception.ExternalServiceException;
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

/**
 * Client for the platform's notification service.
 * <p>
 * Creating a notification stores it and its recipient rows (and queues the e-mail copy when asked);
 * push delivery to devices is a separate call.
 */
@Slf4j
@Component
public class NotificationServiceClient {

    private final WebClient webClient;
    private final NotificationServiceProperties properties;

    public NotificationServiceClient(@Qualifier("notificationServiceWebClient") WebClient webClient,
                                     NotificationServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Create a notification for a set of students
     *
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "notificationService", fallbackMethod = "createNotificationFallback")
    @Retry(name = "notificationService")
    public CreateNotificationResponse createNotification(CreateNotificationRequest request) {
        log.info("Calling Notification Service to create notification '{}' for {} recipients",
                request.getTitle(), request.getRecipients().size());

        try {
            return webClient.post()
                    .uri("/api/v1/notifications")
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException("Notification Service", response.statusCode().value(), body))))
                    .bodyToMono(CreateNotificationResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to create notification '{}': {}", request.getTitle(), e.getMessage());
            throw new ExternalServiceException("Notification Service", e);
        }
    }

    /**
     * Fallback for an open circuit only
     */
    @SuppressWarnings("unused")
    private CreateNotificationResponse createNotificationFallback(CreateNotificationRequest request, CallNotPermittedException e) {
        log.warn("Circuit breaker open for Notification Service, notification: '{}', error: {}", request.getTitle(), e.getMessage());
        throw new ExternalServiceException("Notification Service", "Service temporarily unavailable (circuit breaker open)", e);
    }

    /**
     * Deliver a push message to the registered devices of the recipients
     *
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "notificationService")
    @Retry(name = "notificationService")
    public PushResponse sendPush(PushRequest request) {
        log.debug("Calling Notification Service to push '{}' to {} recipients", request.getTitle(), request.getRecipientIds().size());

        try {
            return webClient.post()
                    .uri("/api/v1/push/send")
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException("Notification Service", response.statusCode().value(), body))))
                    .bodyToMono(PushResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to push '{}': {}", request.getTitle(), e.getMessage());
            throw new ExternalServiceException("Notification Service", e);
        }
    }
}
