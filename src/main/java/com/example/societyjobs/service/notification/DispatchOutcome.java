package com.example.societyjobs.service.notification;

import lombok.Value;

/**
 * Result of handing one notification to the notification service.
 * Push delivery is not part of the outcome; it completes later in the background.
 */
@Value
public class DispatchOutcome {

    boolean success;
    int recipientCount;
    String errorMessage;

    public static DispatchOutcome delivered(int recipientCount) {
        return new DispatchOutcome(true, recipientCount, null);
    }

    public static DispatchOutcome noRecipients() {
        return new DispatchOutcome(true, 0, null);
    }

    public static DispatchOutcome failed(String errorMessage) {
        return new DispatchOutcome(false, 0, errorMessage);
    }

    public boolean isFailed() {
        return !success;
    }
}
