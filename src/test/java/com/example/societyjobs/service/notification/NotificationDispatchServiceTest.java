package com.example.societyjobs.service.notification;

import com.example.societyjobs.client.ClientModels.CreateNotificationRequest;
import com.example.societyjobs.client.ClientModels.CreateNotificationResponse;
import com.example.societyjobs.client.ClientModels.PushRequest;
import com.example.societyjobs.client.ClientModels.PushResponse;
import com.example.societyjobs.client.NotificationServiceClient;
import com.example.societyjobs.config.MetricsConfig;
import com.example.societyjobs.exception.ExternalServiceException;
import com.example.societyjobs.service.cache.ReminderDedupCache;
import com.example.societyjobs.service.registry.JobRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationDispatchService Tests")
class NotificationDispatchServiceTest {

    private static final UUID EVENT_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final List<UUID> RECIPIENTS = List.of(UUID.randomUUID(), UUID.randomUUID());

    @Mock
    private NotificationServiceClient client;

    @Captor
    private ArgumentCaptor<CreateNotificationRequest> createCaptor;

    @Captor
    private ArgumentCaptor<PushRequest> pushCaptor;

    private SimpleMeterRegistry meterRegistry;
    private MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(meterRegistry, new JobRegistry(), new ReminderDedupCache(Clock.systemUTC()));
    }

    private NotificationDispatchService serviceWith(TaskExecutor executor) {
        return new NotificationDispatchService(client, executor, metricsConfig);
    }

    private double backgroundFailures(String reason) {
        var counter = meterRegistry.find("society_jobs_background_dispatch_failures").tag("reason", reason).counter();
        return counter == null ? 0 : counter.count();
    }

    private static NotificationRequest eventRequest() {
        return NotificationRequest.forEvent(EVENT_ID)
                .title("Event Reminder: Hack Night")
                .description("Reminder: The event 'Hack Night' starts in 1 hour at 18:00.")
                .recipients(RECIPIENTS)
                .build();
    }

    @Nested
    @DisplayName("Creation")
    class CreationTests {

        @Test
        @DisplayName("Should create the notification with redirects and one recipient per student")
        void shouldCreateNotification() {
            // Given
            when(client.createNotification(any(CreateNotificationRequest.class)))
                    .thenReturn(CreateNotificationResponse.builder().notificationId("n-1").recipientCount(2).build());
            when(client.sendPush(any(PushRequest.class))).thenReturn(PushResponse.builder().sent(2).failed(0).build());

            // When
            var outcome = serviceWith(Runnable::run).dispatch(eventRequest());

            // Then
            assertThat(outcome.isFailed()).isFalse();
            assertThat(outcome.getRecipientCount()).isEqualTo(2);

            verify(client).createNotification(createCaptor.capture());
            var request = createCaptor.getValue();
            assertThat(request.getWebRedirectUrl()).isEqualTo("/event/" + EVENT_ID);
            assertThat(request.getMobileRedirectUrl().getPathname()).isEqualTo("/event/[id]");
            assertThat(request.getMobileRedirectUrl().getParams()).containsEntry("id", EVENT_ID.toString());
            assertThat(request.getRecipients())
                    .hasSize(2)
                    .allMatch(recipient -> "student".equals(recipient.getRecipientType()));
            assertThat(request.getRecipients().get(0).getRecipientId()).isEqualTo(RECIPIENTS.get(0).toString());
        }

        @Test
        @DisplayName("Should report a failed outcome and skip push when creation fails")
        void shouldReportCreationFailure() {
            // Given
            when(client.createNotification(any(CreateNotificationRequest.class)))
                    .thenThrow(new ExternalServiceException("Notification Service", 503, "unavailable"));

            // When
            var outcome = serviceWith(Runnable::run).dispatch(eventRequest());

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.getErrorMessage()).contains("Notification Service");
            verify(client, never()).sendPush(any(PushRequest.class));
        }

        @Test
        @DisplayName("Should not call the service for an empty audience")
        void shouldSkipEmptyAudience() {
            var outcome = serviceWith(Runnable::run).dispatch(NotificationRequest.builder().title("Nobody").build());

            assertThat(outcome.isFailed()).isFalse();
            assertThat(outcome.getRecipientCount()).isZero();
            verifyNoInteractions(client);
        }
    }

    @Nested
    @DisplayName("Background push")
    class PushTests {

        @Test
        @DisplayName("Should push to every recipient with the notification text")
        void shouldSendPush() {
            // Given
            when(client.createNotification(any(CreateNotificationRequest.class)))
                    .thenReturn(CreateNotificationResponse.builder().notificationId("n-1").recipientCount(2).build());
            when(client.sendPush(any(PushRequest.class))).thenReturn(PushResponse.builder().sent(1).failed(1).build());

            // When
            serviceWith(Runnable::run).dispatch(eventRequest());

            // Then
            verify(client).sendPush(pushCaptor.capture());
            assertThat(pushCaptor.getValue().getRecipientIds())
                    .containsExactly(RECIPIENTS.get(0).toString(), RECIPIENTS.get(1).toString());
            assertThat(pushCaptor.getValue().getBody()).startsWith("Reminder: The event 'Hack Night'");
            assertThat(backgroundFailures("push_error")).isZero();
        }

        @Test
        @DisplayName("Should count a push error without failing the dispatch")
        void shouldCountPushError() {
            // Given
            when(client.createNotification(any(CreateNotificationRequest.class)))
                    .thenReturn(CreateNotificationResponse.builder().notificationId("n-1").recipientCount(2).build());
            when(client.sendPush(any(PushRequest.class))).thenThrow(new IllegalStateException("push gateway down"));

            // When
            var outcome = serviceWith(Runnable::run).dispatch(eventRequest());

            // Then
            assertThat(outcome.isFailed()).isFalse();
            assertThat(backgroundFailures("push_error")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should count a rejected push when the executor is saturated")
        void shouldCountRejectedPush() {
            // Given
            when(client.createNotification(any(CreateNotificationRequest.class)))
                    .thenReturn(CreateNotificationResponse.builder().notificationId("n-1").recipientCount(2).build());
            TaskExecutor saturated = task -> {
                throw new TaskRejectedException("queue full");
            };

            // When
            var outcome = serviceWith(saturated).dispatch(eventRequest());

            // Then
            assertThat(outcome.isFailed()).isFalse();
            assertThat(backgroundFailures("rejected")).isEqualTo(1.0);
            verify(client, never()).sendPush(any(PushRequest.class));
        }
    }
}
