package com.flagship.pledge_compliance.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sink: writes notifications to the log.
 *
 * A delivering sink replaces it by being declared {@code @Primary}.
 */
@Component
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void send(Notification notification) {
        log.info("Notification {} for donor {} <{}>: {} {}",
                notification.getType(),
                notification.getDonorId(),
                notification.getRecipientEmail(),
                notification.getSubject(),
                notification.getAttributes());
    }
}
