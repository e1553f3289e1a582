package com.rabbilite.core.error;

/**
 * Base of every failure surfaced by the client. Unchecked so callers can decide where to handle it;
 * the broker-level cause is always attached.
 */
public class MqException extends RuntimeException {

    public MqException(String message) {
        super(message);
    }

    public MqException(String message, Throwable cause) {
        super(message, cause);
    }
}
