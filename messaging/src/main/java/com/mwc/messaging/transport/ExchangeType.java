package com.mwc.messaging.transport;

import java.util.Locale;

/**
 * AMQP 0-9-1 exchange routing kinds.
 */
public enum ExchangeType {
    DIRECT("direct"),
    TOPIC("topic"),
    FANOUT("fanout"),
    HEADERS("headers");

    private final String type;

    ExchangeType(String type) {
        this.type = type;
    }

    /**
     * @return the wire name of the exchange type, e.g. "direct"
     */
    public String getType() {
        return type;
    }

    public static ExchangeType fromString(String value) {
        if (value == null || value.isBlank()) {
            return DIRECT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
