package com.flagship.pledge_compliance.consumer;

import com.flagship.pledge_compliance.celebration.event.CelebrationCreatedEvent;
import com.flagship.pledge_compliance.celebration.event.CelebrationStatusChangedEvent;
import com.flagship.pledge_compliance.celebration.event.TipLimitReachedEvent;
import com.flagship.pledge_compliance.notification.Notification;
import com.flagship.pledge_compliance.notification.NotificationDispatcher;
import com.flagship.pledge_compliance.notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Turns celebration events into donor notifications.
 *
 * Called by {@link CelebrationEventConsumer} after the duplicate check. Delivery
 * failures are absorbed by the dispatcher, so a broken mail relay never causes
 * the event to be redelivered.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CelebrationEventHandler {

    private final NotificationDispatcher notificationDispatcher;

    public void onCelebrationCreated(CelebrationCreatedEvent event) {
        log.info("Sending receipt for celebration {}: donation={}, tip={}, fee={}",
                event.getCelebrationId(), event.getDonationAmount(), event.getTipAmount(), event.getFee());

        notificationDispatcher.dispatch(Notification.builder()
                .type(NotificationType.RECEIPT)
                .donorId(event.getDonorId())
                .recipientEmail(event.getDonorEmail())
                .subject("Your celebration receipt")
                .attribute("celebrationId", event.getCelebrationId())
                .attribute("donorName", event.getDonorName())
                .attribute("politicianId", event.getPoliticianId())
                .attribute("billId", event.getBillId())
                .attribute("donationAmount", event.getDonationAmount())
                .attribute("tipAmount", event.getTipAmount())
                .attribute("fee", event.getFee())
                .attribute("tipTruncated", event.isTipTruncated())
                .build());
    }

    public void onTipLimitReached(TipLimitReachedEvent event) {
        log.info("Donor {} reached the PAC limit on celebration {}", event.getDonorId(), event.getCelebrationId());

        notificationDispatcher.dispatch(Notification.builder()
                .type(NotificationType.PAC_LIMIT_REACHED)
                .donorId(event.getDonorId())
                .recipientEmail(event.getDonorEmail())
                .subject("You have reached the annual PAC tip limit")
                .attribute("pacLimit", event.getPacLimit())
                .attribute("pacTotal", event.getPacTotal())
                .attribute("tipTruncated", event.isTipTruncated())
                .build());
    }

    /**
     * Defunct conversions are announced per donor by the session service, so
     * they are not repeated here.
     */
    public void onStatusChanged(CelebrationStatusChangedEvent event) {
        if ("defunct".equals(event.getNewStatus())) {
            log.debug("Celebration {} became defunct, donor notice already sent in bulk", event.getCelebrationId());
            return;
        }

        notificationDispatcher.dispatch(Notification.builder()
                .type(NotificationType.STATUS_CHANGED)
                .donorId(event.getDonorId())
                .recipientEmail(event.getDonorEmail())
                .subject("Your celebration is now " + event.getNewStatus())
                .attribute("celebrationId", event.getCelebrationId())
                .attribute("previousStatus", event.getPreviousStatus())
                .attribute("newStatus", event.getNewStatus())
                .attribute("reason", event.getReason())
                .build());
    }
}
