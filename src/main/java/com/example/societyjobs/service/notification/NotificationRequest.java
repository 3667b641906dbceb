package com.example.societyjobs.service.notification;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A notification addressed to a set of students.
 * <p>
 * Redirect targets point the web and mobile clients at the related screen.
 */
@Value
@Builder
public class NotificationRequest {

    String title;
    String description;
    String image;
    String webRedirectUrl;
    String mobilePathname;

    @Singular("mobileParam")
    Map<String, String> mobileParams;

    @Singular
    List<UUID> recipients;

    boolean sendEmail;

    public static NotificationRequestBuilder forEvent(UUID eventId) {
        return builder()
                .webRedirectUrl("/event/" + eventId)
                .mobilePathname("/event/[id]")
                .mobileParam("id", eventId.toString());
    }
}
