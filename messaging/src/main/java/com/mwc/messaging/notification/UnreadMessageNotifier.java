package com.mwc.messaging.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mwc.messaging.transport.Delivery;
import com.mwc.messaging.transport.MessageQueueService;
import com.mwc.messaging.transport.PublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Schedules "is this chat message still unread?" checks through the delayed
 * delivery topology and hands them to a listener once the delay has elapsed.
 *
 * <p>Messages published to the delay exchange wait in the delay queue until
 * their TTL expires, then are dead-lettered to the actual exchange and routed
 * to the email processing queue.</p>
 *
 * <pre>
 * publish ──► notifications.unread_messages.delay.exchange
 *               └─► q.notifications.unread_messages.delay      (TTL)
 *                     └─► notifications.unread_messages.actual.exchange
 *                           └─► q.notifications.unread_messages.email.processing
 * </pre>
 */
public class UnreadMessageNotifier {

    private static final Logger log = LoggerFactory.getLogger(UnreadMessageNotifier.class);

    public static final String DELAY_EXCHANGE = "notifications.unread_messages.delay.exchange";
    public static final String DELAY_QUEUE = "q.notifications.unread_messages.delay";
    public static final String ACTUAL_EXCHANGE = "notifications.unread_messages.actual.exchange";
    public static final String ACTUAL_ROUTING_KEY = "process.unread.email";
    public static final String PROCESSING_QUEUE = "q.notifications.unread_messages.email.processing";

    public static final Duration DEFAULT_DELAY = Duration.ofMinutes(5);

    private final MessageQueueService service;
    private final ObjectMapper objectMapper;
    private final Duration delay;

    public UnreadMessageNotifier(MessageQueueService service) {
        this(service, new ObjectMapper(), DEFAULT_DELAY);
    }

    public UnreadMessageNotifier(MessageQueueService service, ObjectMapper objectMapper, Duration delay) {
        this.service = Objects.requireNonNull(service, "service");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        // a message without TTL would stay in the delay queue
        if (delay == null || delay.toMillis() <= 0) {
            throw new IllegalArgumentException("delay must be at least 1 ms: " + delay);
        }
        this.delay = delay;
    }

    /**
     * Declare the delay pipeline and the processing queue bound behind it.
     *
     * @return false if the service has no broker and nothing was declared
     */
    public boolean declareTopology() {
        if (!service.isInitialized()) {
            log.info("Message queue not initialized, skipping unread-message topology");
            return false;
        }
        service.declareDelayedSetup(DELAY_EXCHANGE, DELAY_QUEUE, ACTUAL_EXCHANGE, ACTUAL_ROUTING_KEY);
        service.declareQueue(PROCESSING_QUEUE, true, null);
        service.bindQueue(PROCESSING_QUEUE, ACTUAL_ROUTING_KEY, ACTUAL_EXCHANGE);
        log.info("Unread-message topology declared (delay {} ms)", delay.toMillis());
        return true;
    }

    /**
     * Publish a check that reaches the processing queue after the configured delay.
     */
    public void scheduleCheck(UnreadMessagePayload payload) {
        Objects.requireNonNull(payload, "payload");
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new PublishException("failed to serialize unread-message payload", e);
        }
        // the delay queue is bound to the delay exchange under its own name
        service.publish(DELAY_EXCHANGE, DELAY_QUEUE, body, delay.toMillis());
        log.debug("Scheduled unread check: message={}, recipient={}", payload.messageId(), payload.recipientId());
    }

    /**
     * Consume the processing queue. A body that does not decode is rejected
     * like any other listener failure.
     */
    public void listen(String consumerTag, UnreadMessageListener listener) {
        Objects.requireNonNull(listener, "listener");
        service.consume(PROCESSING_QUEUE, consumerTag, delivery -> listener.onUnreadMessage(decode(delivery)));
    }

    UnreadMessagePayload decode(Delivery delivery) throws IOException {
        try {
            return objectMapper.readValue(delivery.body(), UnreadMessagePayload.class);
        } catch (IOException e) {
            log.error("Failed to decode unread-message payload: {}", e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("Raw message body: {}", delivery.bodyAsString());
            }
            throw e;
        }
    }

    public Duration getDelay() {
        return delay;
    }
}
