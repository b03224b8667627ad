package com.mwc.messaging.transport;

/**
 * Registering a consumer failed.
 */
public class ConsumeException extends TransportException {

    public ConsumeException(String message) {
        super(message);
    }

    public ConsumeException(String message, Throwable cause) {
        super(message, cause);
    }
}
