package com.rabbilite.core.error;

/** Queue/exchange declaration or binding rejected by the broker (usually a property mismatch). */
public class TopologyException extends MqException {

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
