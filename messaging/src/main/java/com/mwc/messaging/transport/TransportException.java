package com.mwc.messaging.transport;

/**
 * Base class for failures reported by a {@link MessageQueueService}.
 *
 * <p>Unchecked: callers on the steady-state path (publish, ack) are expected to
 * log and degrade rather than handle every broker hiccup explicitly.</p>
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
