package com.flagship.pledge_compliance.notification;

import com.flagship.pledge_compliance.observability.ComplianceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget front for the notification sink.
 *
 * A failed notification is logged and counted, then dropped. It never
 * propagates into the approved donation or applied transition that caused it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final NotificationSink sink;
    private final ComplianceMetrics metrics;

    /**
     * @return true if the sink accepted the notification
     */
    public boolean dispatch(Notification notification) {
        try {
            sink.send(notification);
            return true;
        } catch (Exception e) {
            log.error("Failed to send {} notification to donor {}: {}",
                    notification.getType(), notification.getDonorId(), e.getMessage(), e);
            metrics.recordNotificationFailure(notification.getType().name());
            return false;
        }
    }
}
