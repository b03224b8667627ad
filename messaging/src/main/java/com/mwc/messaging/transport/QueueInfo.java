package com.mwc.messaging.transport;

/**
 * Result of a queue declaration.
 *
 * @param name          queue name (server-generated when declared with an empty name)
 * @param messageCount  ready messages at declaration time, {@code -1} if unknown (no-wait)
 * @param consumerCount active consumers at declaration time, {@code -1} if unknown (no-wait)
 */
public record QueueInfo(String name, int messageCount, int consumerCount) {

    public static QueueInfo unknown(String name) {
        return new QueueInfo(name, -1, -1);
    }
}
