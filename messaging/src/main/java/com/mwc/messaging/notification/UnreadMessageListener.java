package com.mwc.messaging.notification;

/**
 * Callback for unread-message checks whose delay has elapsed.
 *
 * <p>Typically looks the message up, and if it is still unread emails the
 * recipient. Throwing rejects the check without requeue.</p>
 *
 * <p>Example usage:</p>
 * <pre>
 * notifier.listen("unread-email-worker", payload -&gt; {
 *     if (!messages.isRead(payload.messageId())) {
 *         mailer.sendUnreadReminder(payload.recipientId(), payload.messageId());
 *     }
 * });
 * </pre>
 */
@FunctionalInterface
public interface UnreadMessageListener {

    /**
     * @param payload the check published when the message was sent
     * @throws Exception to reject the check
     */
    void onUnreadMessage(UnreadMessagePayload payload) throws Exception;
}
