package com.rabbilite.core.consumer;

/**
 * Application logic for one delivery. Returning normally acks the message; throwing anything rejects it
 * and the {@link RedeliveryPolicy} decides whether it goes back to the queue.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(byte[] payload) throws Exception;
}
