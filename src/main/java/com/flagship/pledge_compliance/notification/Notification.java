package com.flagship.pledge_compliance.notification;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * A "notify donor of X" request. Rendering and delivery belong to the sink.
 */
@Value
@Builder
public class Notification {
    NotificationType type;
    UUID donorId;
    String recipientEmail;
    String subject;
    @Singular("attribute")
    Map<String, Object> attributes;
}
