package com.rabbilite.core.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Buffers deliveries pushed by the client library's dispatcher so a single loop thread can take them one at a
 * time. The stream ends when the consumer is cancelled or the channel shuts down.
 */
class DeliveryStream extends DefaultConsumer {
    private static final Logger log = LoggerFactory.getLogger(DeliveryStream.class);

    private static final Delivery END = new Delivery(null, null, new byte[0]);

    private final BlockingQueue<Delivery> buffer = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private volatile ShutdownSignalException shutdown;

    DeliveryStream(Channel channel) {
        super(channel);
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope env, AMQP.BasicProperties props, byte[] body) {
        if (ended.get()) {
            return;
        }
        buffer.add(new Delivery(env, props, body));
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        end();
    }

    @Override
    public void handleCancel(String consumerTag) {
        log.warn("[MQ] Consumer {} cancelled by broker (queue deleted?)", consumerTag);
        end();
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        this.shutdown = sig;
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        // unacked deliveries go back to the queue when the channel dies; nothing left to settle here
        int dropped = buffer.size();
        buffer.clear();
        buffer.add(END);
        if (dropped > 0) {
            log.info("[MQ] Consumer {} shut down with {} buffered deliveries; broker will redeliver them",
                    consumerTag, dropped);
        }
    }

    private void end() {
        if (ended.compareAndSet(false, true)) {
            buffer.add(END);
        }
    }

    /** Blocks for the next delivery; null once the stream has ended. */
    Delivery next() throws InterruptedException {
        Delivery d = buffer.take();
        if (d == END) {
            buffer.add(END);
            return null;
        }
        return d;
    }

    boolean isShutdown() {
        return shutdown != null;
    }

    boolean hasEnded() {
        return ended.get();
    }
}
