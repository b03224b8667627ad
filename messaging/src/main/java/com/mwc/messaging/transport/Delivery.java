package com.mwc.messaging.transport;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * A message handed to a {@link DeliveryHandler}.
 *
 * <p>The delivery tag identifies the message on the channel it arrived on and
 * is resolved exactly once by the consumer runtime: acknowledged if the
 * handler returns, rejected without requeue if it throws.</p>
 *
 * @param consumerTag  tag of the subscription that received the message
 * @param deliveryTag  channel-scoped, monotonically assigned delivery id
 * @param redelivered  true if the broker delivered this message before
 * @param exchange     exchange the message was last routed through
 * @param routingKey   routing key the message was last routed with
 * @param body         raw payload
 * @param contentType  content type set by the publisher, may be null
 * @param timestamp    publish timestamp, may be null
 * @param persistent   true for delivery mode 2
 * @param expiration   per-message TTL in milliseconds as published, null if none
 * @param headers      message headers, never null
 */
public record Delivery(
        String consumerTag,
        long deliveryTag,
        boolean redelivered,
        String exchange,
        String routingKey,
        byte[] body,
        String contentType,
        Instant timestamp,
        boolean persistent,
        String expiration,
        Map<String, Object> headers
) {
    public Delivery {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
