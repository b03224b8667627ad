package com.mwc.messaging.transport;

/**
 * A declare or consume call was made while no broker connection is available,
 * either because none was configured or because the service has been closed.
 */
public class NotInitializedException extends TransportException {

    public NotInitializedException(String operation) {
        super("RabbitMQ channel not initialized, cannot " + operation);
    }
}
