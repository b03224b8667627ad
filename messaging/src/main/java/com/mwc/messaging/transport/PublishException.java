package com.mwc.messaging.transport;

public class PublishException extends TransportException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
