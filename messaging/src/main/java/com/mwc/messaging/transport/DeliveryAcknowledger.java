package com.mwc.messaging.transport;

/**
 * Transmits the final disposition of a delivery back to the broker.
 */
public interface DeliveryAcknowledger {

    void ack(long deliveryTag) throws Exception;

    void reject(long deliveryTag, boolean requeue) throws Exception;
}
