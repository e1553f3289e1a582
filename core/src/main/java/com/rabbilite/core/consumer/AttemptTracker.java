package com.rabbilite.core.consumer;

import com.rabbitmq.client.Envelope;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts failed handler invocations per message. Messages are identified by their {@code message-id}
 * property, or by a SHA-256 of exchange, routing key and body when the publisher did not set one. Without a
 * message id, two distinct messages with identical body that were published the same way are indistinguishable
 * and share one failure count, so a limited policy may give up on the second one early. Publishers that need
 * exact per-message limits set {@code message-id} ({@code MessageProducer} always does). Only the delivery loop
 * thread touches an instance.
 */
final class AttemptTracker {
    static final int DEFAULT_CAPACITY = 10_000;

    private final Map<String, Integer> failures;

    AttemptTracker() {
        this(DEFAULT_CAPACITY);
    }

    AttemptTracker(int capacity) {
        this.failures = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                return size() > capacity;
            }
        };
    }

    /** Records one more failure and returns the attempt count for the message. */
    long recordFailure(Delivery d) {
        int local = failures.merge(identity(d), 1, Integer::sum);
        long broker = d.brokerDeliveryCount();
        return broker >= 0 ? Math.max(broker + 1, local) : local;
    }

    void forget(Delivery d) {
        failures.remove(identity(d));
    }

    int size() {
        return failures.size();
    }

    static String identity(Delivery d) {
        String id = d.props() == null ? null : d.props().getMessageId();
        if (id != null && !id.isEmpty()) return "id:" + id;
        return "sha256:" + sha256(d.envelope(), d.body());
    }

    private static String sha256(Envelope env, byte[] body) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            if (env != null) {
                md.update(String.valueOf(env.getExchange()).getBytes(StandardCharsets.UTF_8));
                md.update((byte) 0);
                md.update(String.valueOf(env.getRoutingKey()).getBytes(StandardCharsets.UTF_8));
                md.update((byte) 0);
            }
            return HexFormat.of().formatHex(md.digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
