package com.rabbilite.core.consumer;

import com.rabbilite.core.connection.ConnectionManager;
import com.rabbilite.core.error.MqException;
import com.rabbitmq.client.AMQP;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Takes deliveries off one {@link DeliveryStream} strictly one after another, runs the handler and settles each
 * delivery with exactly one ack decision before taking the next.
 */
class DeliveryLoop implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DeliveryLoop.class);

    static final String FAILURE_HEADER = "x-rabbilite-failure";

    private final ConnectionManager mq;
    private final DeliveryStream stream;
    private final String queueName;
    private final String parkingQueue;
    private final MessageHandler handler;
    private final RedeliveryPolicy policy;
    private final AttemptTracker attempts = new AttemptTracker();

    private volatile boolean cancelRequested;

    DeliveryLoop(ConnectionManager mq, DeliveryStream stream, String queueName, String parkingQueue,
                 MessageHandler handler, RedeliveryPolicy policy) {
        this.mq = mq;
        this.stream = stream;
        this.queueName = queueName;
        this.parkingQueue = parkingQueue;
        this.handler = handler;
        this.policy = policy;
    }

    void requestCancel() {
        cancelRequested = true;
    }

    /** Back to normal dispatch after the cancel could not be delivered to the broker. */
    void withdrawCancel() {
        cancelRequested = false;
    }

    @Override
    public void run() {
        log.debug("[MQ] Delivery loop for {} started", queueName);
        try {
            while (true) {
                Delivery d = stream.next();
                if (d == null) break;
                if (cancelRequested) {
                    // buffered before the cancel-ok arrived; hand it back untouched
                    settle(d, AckDecision.NACK_REQUEUE, null);
                    continue;
                }
                dispatch(d);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[MQ] Delivery loop for {} interrupted", queueName);
        }
        log.info("[MQ] Delivery loop for {} finished{}", queueName,
                stream.isShutdown() ? " (channel shut down)" : "");
    }

    void dispatch(Delivery d) {
        AckDecision decision;
        Throwable failure = null;
        try {
            handler.handle(d.body());
            decision = AckDecision.ACK;
        } catch (Exception | Error e) {
            // an Error from the handler is just a failed attempt; the loop keeps serving the stream
            failure = e;
            long n = attempts.recordFailure(d);
            decision = policy.onFailure(n);
            log.error("Error handling message from {} tag={} attempt={} -> {}: {}",
                    queueName, d.deliveryTag(), n, decision, e.toString());
        }
        settle(d, decision, failure);
    }

    private void settle(Delivery d, AckDecision decision, Throwable failure) {
        final long tag = d.deliveryTag();
        try {
            switch (decision) {
                case ACK:
                    mq.withChannel(ch -> { ch.basicAck(tag, false); return null; });
                    attempts.forget(d);
                    break;
                case NACK_REQUEUE:
                    mq.withChannel(ch -> { ch.basicNack(tag, false, true); return null; });
                    break;
                case REJECT:
                    mq.withChannel(ch -> { ch.basicReject(tag, false); return null; });
                    attempts.forget(d);
                    log.warn("[NACK] Gave up on message from {} tag={} after {}", queueName, tag, policy);
                    break;
                case PARK:
                    park(d, failure);
                    attempts.forget(d);
                    break;
                default:
                    throw new IllegalStateException("Unhandled decision " + decision);
            }
            if (log.isDebugEnabled()) {
                log.debug("[{}] queue={} deliveryTag={} redelivered={}",
                        decision, queueName, tag, d.redelivered());
            }
        } catch (IOException | MqException e) {
            log.error("Failed to {} tag={} queue={}: {}", decision, tag, queueName, e.toString());
        }
    }

    private void park(Delivery d, Throwable failure) throws IOException {
        String parking = parkingQueue;
        AMQP.BasicProperties src = d.props() == null ? new AMQP.BasicProperties() : d.props();
        Map<String, Object> headers = src.getHeaders() == null ? new HashMap<>() : new HashMap<>(src.getHeaders());
        headers.put(FAILURE_HEADER, failure == null ? "unknown" : failure.toString());
        AMQP.BasicProperties props = src.builder().headers(headers).deliveryMode(2).build();
        long tag = d.deliveryTag();
        mq.withChannel(ch -> {
            try {
                ch.queueDeclare(parking, true, false, false, null);
                ch.basicPublish("", parking, props, d.body());
            } catch (IOException e) {
                ch.basicNack(tag, false, true);
                throw e;
            }
            ch.basicAck(tag, false);
            return null;
        });
        log.warn("[ACK] Parked message from {} tag={} in {} after {}", queueName, tag, parking, policy);
    }
}
