package com.rabbilite.core.consumer;

import com.rabbilite.core.json.JsonUtils;

/** Adapts a typed callback to {@link MessageHandler}; a payload that does not decode counts as a failure. */
public final class JsonMessageHandler<T> implements MessageHandler {

    @FunctionalInterface
    public interface TypedHandler<T> {
        void handle(T message) throws Exception;
    }

    private final Class<T> type;
    private final TypedHandler<T> delegate;

    private JsonMessageHandler(Class<T> type, TypedHandler<T> delegate) {
        this.type = type;
        this.delegate = delegate;
    }

    public static <T> JsonMessageHandler<T> of(Class<T> type, TypedHandler<T> delegate) {
        return new JsonMessageHandler<>(type, delegate);
    }

    @Override
    public void handle(byte[] payload) throws Exception {
        delegate.handle(JsonUtils.fromBytes(payload, type));
    }
}
