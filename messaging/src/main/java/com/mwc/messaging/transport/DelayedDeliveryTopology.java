package com.mwc.messaging.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the exchange/queue pair that turns per-message TTL into a delay.
 *
 * <pre>
 * publish(ttl) → delayExchange ──[key = delayQueue]──▶ delayQueue
 *                                                       │ ttl elapses
 *                                                       ▼ dead-letter
 *                                        actualExchange ──[actualRoutingKey]──▶ consumers
 * </pre>
 *
 * <p>Steps run in order and the first failure aborts the rest. Messages with
 * different TTLs in the same delay queue expire from the head only, so a short
 * delay queued behind a long one waits for it: the delay is a lower bound.</p>
 */
public final class DelayedDeliveryTopology {

    private static final Logger log = LoggerFactory.getLogger(DelayedDeliveryTopology.class);

    private DelayedDeliveryTopology() {}

    public static void declare(MessageQueueService service, String delayExchange, String delayQueue,
                               String actualExchange, String actualRoutingKey) {
        if (!service.isInitialized()) {
            log.info("Message queue not initialized, skipping delayed delivery setup for {}", delayQueue);
            return;
        }

        try {
            service.declareExchange(actualExchange, ExchangeType.DIRECT, true, false, false, false, null);
        } catch (TransportException e) {
            throw new TopologyException("failed to declare actual exchange '" + actualExchange + "'", e);
        }

        try {
            service.declareQueue(delayQueue, true, false, false, false,
                    QueueArguments.deadLetter(actualExchange, actualRoutingKey));
        } catch (TransportException e) {
            throw new TopologyException("failed to declare delay queue '" + delayQueue + "'", e);
        }

        try {
            service.declareExchange(delayExchange, ExchangeType.DIRECT, true, false, false, false, null);
        } catch (TransportException e) {
            throw new TopologyException("failed to declare delay exchange '" + delayExchange + "'", e);
        }

        // direct exchange needs an exact key; reuse the queue name
        try {
            service.bindQueue(delayQueue, delayQueue, delayExchange, false, null);
        } catch (TransportException e) {
            throw new TopologyException("failed to bind delay queue '" + delayQueue
                    + "' to delay exchange '" + delayExchange + "'", e);
        }

        log.info("Declared delayed delivery: delayExchange={}, delayQueue={}, actualExchange={}, actualRoutingKey={}",
                delayExchange, delayQueue, actualExchange, actualRoutingKey);
    }
}
