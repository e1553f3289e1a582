package com.rabbilite.core.error;

/** Publish, consume or confirm failed on an open (or unexpectedly closed) channel. */
public class TransportException extends MqException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
