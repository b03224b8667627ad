package com.mwc.messaging.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Well-known {@code x-} queue arguments understood by RabbitMQ.
 */
public final class QueueArguments {

    public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    public static final String MESSAGE_TTL = "x-message-ttl";

    private QueueArguments() {}

    /**
     * Arguments that make a queue forward expired and rejected messages to
     * {@code exchange}. A {@code null} routing key keeps the message's own key.
     */
    public static Map<String, Object> deadLetter(String exchange, String routingKey) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(DEAD_LETTER_EXCHANGE, exchange);
        if (routingKey != null) {
            args.put(DEAD_LETTER_ROUTING_KEY, routingKey);
        }
        return args;
    }

    public static String deadLetterExchange(Map<String, Object> args) {
        return stringArg(args, DEAD_LETTER_EXCHANGE);
    }

    public static String deadLetterRoutingKey(Map<String, Object> args) {
        return stringArg(args, DEAD_LETTER_ROUTING_KEY);
    }

    /**
     * Copy of {@code args} that is never null, for comparing declarations.
     */
    public static Map<String, Object> normalize(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    private static String stringArg(Map<String, Object> args, String key) {
        if (args == null) return null;
        Object val = args.get(key);
        return val == null ? null : String.valueOf(val);
    }
}
