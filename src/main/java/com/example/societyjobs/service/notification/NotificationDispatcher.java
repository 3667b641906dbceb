package com.example.societyjobs.service.notification;

/**
 * Delivers notifications to students.
 */
public interface NotificationDispatcher {

    /**
     * Create the notification for every recipient and start device push delivery.
     * Never throws; failures are reported in the outcome.
     */
    DispatchOutcome dispatch(NotificationRequest request);
}
