package com.mwc.messaging.notification;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a delayed unread-message check.
 */
public record UnreadMessagePayload(
        @JsonProperty("message_id") long messageId,
        @JsonProperty("recipient_id") long recipientId,
        @JsonProperty("sender_id") long senderId
) {
}
