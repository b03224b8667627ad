package com.mwc.messaging.transport;

/**
 * The broker rejected an exchange, queue or binding declaration.
 */
public class TopologyException extends TransportException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
