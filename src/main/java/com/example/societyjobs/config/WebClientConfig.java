package com.example.societyjobs.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for the blob storage and notification services,
 * each with its own base URL and timeouts.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Bean(name = "storageServiceWebClient")
    public WebClient storageServiceWebClient(WebClient.Builder builder, StorageServiceProperties properties) {
        return createWebClient(builder, properties.getBaseUrl(), properties.getTimeoutSeconds(), "StorageService");
    }

    @Bean(name = "notificationServiceWebClient")
    public WebClient notificationServiceWebClient(WebClient.Builder builder, NotificationServiceProperties properties) {
        return createWebClient(builder, properties.getBaseUrl(), properties.getTimeoutSeconds(), "NotificationService");
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutSeconds, String serviceName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Service-Name", "society-jobs")
                .filter(logExchange(serviceName))
                .build();
    }

    /**
     * Log outgoing requests and flag error responses
     */
    private ExchangeFilterFunction logExchange(String serviceName) {
        return (request, next) -> {
            log.debug("[{}] Request: {} {}", serviceName, request.method(), request.url());
            return next.exchange(request).flatMap(response -> {
                if (response.statusCode().isError()) {
                    log.warn("[{}] Error response: {} for {} {}", serviceName, response.statusCode(), request.method(), request.url());
                } else {
                    log.debug("[{}] Response status: {}", serviceName, response.statusCode());
                }
                return Mono.just(response);
            });
        };
    }
}
