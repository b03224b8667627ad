package com.mwc.messaging.transport;

/**
 * Business callback invoked once per delivery.
 *
 * <p>Returning normally acknowledges the delivery. Throwing rejects it without
 * requeue, so a queue declared with a dead-letter exchange forwards it there
 * instead of redelivering it forever.</p>
 *
 * <p>Invocations for one subscription are sequential and in broker order;
 * different subscriptions call their handlers from different threads.</p>
 */
@FunctionalInterface
public interface DeliveryHandler {

    /**
     * @param delivery the received message
     * @throws Exception to reject the delivery
     */
    void handle(Delivery delivery) throws Exception;
}
