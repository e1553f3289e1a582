package com.rabbilite.core.error;

/** Broker unreachable, credentials rejected, or the URL could not be parsed. */
public class ConnectivityException extends MqException {

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
