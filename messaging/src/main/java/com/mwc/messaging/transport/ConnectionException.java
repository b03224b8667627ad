package com.mwc.messaging.transport;

/**
 * Connecting, opening a channel, or closing the connection failed.
 */
public class ConnectionException extends TransportException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
