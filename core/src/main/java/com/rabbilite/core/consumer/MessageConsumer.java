package com.rabbilite.core.consumer;

import com.rabbilite.core.config.RabbitConfig;
import com.rabbilite.core.connection.ConnectionManager;
import com.rabbilite.core.error.MqException;
import com.rabbilite.core.error.TopologyException;
import com.rabbilite.core.error.TransportException;
import com.rabbitmq.client.BuiltinExchangeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Consumes a durable work queue or a fanout exchange with manual acknowledgments.
 *
 * <p>Each start call declares the topology, opens the delivery stream and returns; deliveries are then handled
 * one at a time on a dedicated thread. A handler that returns normally acks the delivery, one that throws
 * nacks it back onto the queue until the {@link RedeliveryPolicy} runs out. Handler failures never reach the
 * caller.
 *
 * <p>At most one subscription is active per instance, since all of them would share the one channel.
 */
public class MessageConsumer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageConsumer.class);

    static final Duration CLOSE_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final ConnectionManager mq;
    private final RedeliveryPolicy policy;
    private Subscription current;

    public MessageConsumer(String url) {
        this(ConnectionManager.open(url), RedeliveryPolicy.unlimited());
    }

    public MessageConsumer(RabbitConfig cfg) {
        this(ConnectionManager.open(cfg), cfg.redeliveryPolicy());
    }

    public MessageConsumer(ConnectionManager mq, RedeliveryPolicy policy) {
        this.mq = mq;
        this.policy = policy;
    }

    /**
     * Declares {@code queueName} durable and starts consuming it (shared with other consumers).
     *
     * @throws TopologyException     if the queue exists with different properties
     * @throws TransportException    if the consumer cannot be registered
     * @throws IllegalStateException if a subscription is already active on this instance
     */
    public synchronized Subscription startConsuming(String queueName, MessageHandler handler) {
        ensureIdle();
        try {
            mq.withChannel(ch -> ch.queueDeclare(queueName, true, false, false, null));
        } catch (IOException e) {
            throw new TopologyException("Cannot declare queue " + queueName, e);
        }
        Subscription s = subscribe(queueName, RedeliveryPolicy.parkingQueueFor(queueName), false, handler);
        log.info("Started consuming from queue: {} (redelivery: {})", queueName, policy);
        return s;
    }

    /**
     * Declares the durable fanout exchange plus a private broker-named queue bound to it, and consumes that
     * queue exclusively. The queue disappears with the connection, so messages published while this consumer
     * is away are never seen.
     */
    public synchronized Subscription startConsumingFromFanout(String exchangeName, MessageHandler handler) {
        ensureIdle();
        String queue;
        try {
            mq.withChannel(ch -> ch.exchangeDeclare(exchangeName, BuiltinExchangeType.FANOUT, true));
            queue = mq.withChannel(ch -> ch.queueDeclare("", false, true, true, null).getQueue());
        } catch (IOException e) {
            throw new TopologyException("Cannot declare fanout topology for " + exchangeName, e);
        }
        try {
            mq.withChannel(ch -> ch.queueBind(queue, exchangeName, ""));
        } catch (IOException e) {
            throw new TopologyException("Cannot bind " + queue + " to " + exchangeName, e);
        }
        Subscription s = subscribe(queue, RedeliveryPolicy.parkingQueueFor(exchangeName), true, handler);
        log.info("Started consuming from fanout exchange: {} (using auto-generated queue: {})", exchangeName, queue);
        return s;
    }

    private Subscription subscribe(String queue, String parkingQueue, boolean exclusive, MessageHandler handler) {
        DeliveryStream stream;
        String tag;
        try {
            stream = mq.withChannel(DeliveryStream::new);
            tag = mq.withChannel(ch -> ch.basicConsume(queue, false, "", false, exclusive, null, stream));
        } catch (IOException e) {
            throw new TransportException("Cannot consume from " + queue, e);
        }
        DeliveryLoop loop = new DeliveryLoop(mq, stream, queue, parkingQueue, handler, policy);
        Subscription s = new Subscription(mq, queue, tag, loop);
        s.start();
        current = s;
        return s;
    }

    private void ensureIdle() {
        if (current != null && current.isActive()) {
            throw new IllegalStateException("Already consuming from " + current.queueName()
                    + "; one subscription per consumer instance");
        }
    }

    public boolean isConnected() {
        return mq.isConnected();
    }

    /** Cancels the active subscription, waits briefly for its loop, then closes the connection. */
    @Override
    public void close() {
        Subscription s;
        synchronized (this) {
            s = current;
        }
        if (s != null && s.isActive()) {
            try {
                s.cancel();
                if (!s.awaitTermination(CLOSE_DRAIN_TIMEOUT)) {
                    log.warn("Delivery loop for {} still running after {}; closing anyway",
                            s.queueName(), CLOSE_DRAIN_TIMEOUT);
                }
            } catch (MqException e) {
                log.warn("Error while cancelling consumer on {}: {}", s.queueName(), e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        mq.close();
    }
}
