package com.flagship.pledge_compliance.notification;

/**
 * Outbound channel for donor notifications (email, webhook).
 *
 * Implementations may throw; callers go through {@link NotificationDispatcher},
 * which never lets a failure reach a donation or a status transition.
 */
public interface NotificationSink {

    void send(Notification notification);
}
