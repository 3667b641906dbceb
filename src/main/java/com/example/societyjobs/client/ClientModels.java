package com.example.societyjobs.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request/Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Storage Service Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DestroyResourceRequest {
        private String publicId;
        private String resourceType;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DestroyResourceResponse {
        /**
         * "ok" when the resource was removed, "not found" otherwise
         */
        private String result;
    }

    // === Notification Service Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MobileRedirect {
        private String pathname;
        private Map<String, String> params;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NotificationRecipient {
        @Builder.Default
        private String recipientType = "student";
        private String recipientId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateNotificationRequest {
        private String title;
        private String description;
        private String image;
        private String webRedirectUrl;
        private MobileRedirect mobileRedirectUrl;
        private List<NotificationRecipient> recipients;
        private boolean sendEmail;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateNotificationResponse {
        private String notificationId;
        private int recipientCount;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PushRequest {
        private List<String> recipientIds;
        private String title;
        private String body;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PushResponse {
        private int sent;
        private int failed;
    }
}
