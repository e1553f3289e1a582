package com.rabbilite.core.error;

public class SerializationException extends MqException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
