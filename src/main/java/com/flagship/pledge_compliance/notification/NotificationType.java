package com.flagship.pledge_compliance.notification;

/**
 * Kinds of donor notifications the engine emits.
 */
public enum NotificationType {
    RECEIPT,
    PAC_LIMIT_REACHED,
    CELEBRATION_DEFUNCT,
    DEFUNCT_WARNING,
    STATUS_CHANGED,
    ELECTION_DATE_CHANGED,
    ELECTION_DATE_NOTICE
}
