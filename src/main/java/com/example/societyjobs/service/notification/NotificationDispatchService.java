package com.example.societyjobs.service.notification;

import com.example.societyjobs.client.ClientModels.CreateNotificationRequest;
import com.example.societyjobs.client.ClientModels.MobileRedirect;
import com.example.societyjobs.client.ClientModels.NotificationRecipient;
import com.example.societyjobs.client.ClientModels.PushRequest;
import com.example.societyjobs.client.NotificationServiceClient;
import com.example.societyjobs.config.MetricsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Notification dispatch backed by the notification service.
 * <p>
 * Creation is awaited so callers learn whether it failed. Push delivery runs on the bounded
 * notificationExecutor; its failures (and rejections when the queue is full) are logged
 * and counted but never reach the caller.
 */
@Slf4j
@Service
public class NotificationDispatchService implements NotificationDispatcher {

    private final NotificationServiceClient client;
    private final TaskExecutor notificationExecutor;
    private final MetricsConfig metricsConfig;

    public NotificationDispatchService(NotificationServiceClient client,
                                       @Qualifier("notificationExecutor") TaskExecutor notificationExecutor,
                                       MetricsConfig metricsConfig) {
        this.client = client;
        this.notificationExecutor = notificationExecutor;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public DispatchOutcome dispatch(NotificationRequest request) {
        if (request.getRecipients().isEmpty()) {
            log.debug("Notification '{}' has no recipients, nothing to dispatch", request.getTitle());
            return DispatchOutcome.noRecipients();
        }

        try {
            client.createNotification(toCreateRequest(request));
        } catch (Exception e) {
            log.warn("Failed to create notification '{}': {}", request.getTitle(), e.getMessage());
            return DispatchOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        submitPush(request);
        return DispatchOutcome.delivered(request.getRecipients().size());
    }

    private void submitPush(NotificationRequest request) {
        var push = PushRequest.builder()
                .recipientIds(request.getRecipients().stream().map(UUID::toString).toList())
                .title(request.getTitle())
                .body(request.getDescription())
                .build();

        try {
            notificationExecutor.execute(() -> deliverPush(push));
        } catch (TaskRejectedException e) {
            log.warn("Push delivery for '{}' rejected, executor saturated: {}", request.getTitle(), e.getMessage());
            metricsConfig.recordBackgroundDispatchFailure("rejected");
        }
    }

    private void deliverPush(PushRequest push) {
        try {
            var response = client.sendPush(push);
            if (response != null && response.getFailed() > 0) {
                log.info("Push '{}' reached {} devices, {} failed", push.getTitle(), response.getSent(), response.getFailed());
            }
        } catch (Exception e) {
            log.error("Background push delivery for '{}' failed: {}", push.getTitle(), e.getMessage(), e);
            metricsConfig.recordBackgroundDispatchFailure("push_error");
        }
    }

    private CreateNotificationRequest toCreateRequest(NotificationRequest request) {
        var mobileRedirect = request.getMobilePathname() == null ? null : MobileRedirect.builder()
                .pathname(request.getMobilePathname())
                .params(request.getMobileParams())
                .build();

        return CreateNotificationRequest.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .image(request.getImage())
                .webRedirectUrl(request.getWebRedirectUrl())
                .mobileRedirectUrl(mobileRedirect)
                .recipients(request.getRecipients().stream()
                        .map(id -> NotificationRecipient.builder().recipientId(id.toString()).build())
                        .toList())
                .sendEmail(request.isSendEmail())
                .build();
    }
}
