package com.rabbilite.core.consumer;

import com.rabbilite.core.connection.ConnectionManager;
import com.rabbilite.core.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Handle on one running consumption stream. {@link #cancel()} stops consuming without closing the connection:
 * the delivery in progress finishes and is settled, anything still buffered goes back to the queue.
 */
public class Subscription {
    private static final Logger log = LoggerFactory.getLogger(Subscription.class);

    private final ConnectionManager mq;
    private final String queueName;
    private final String consumerTag;
    private final DeliveryLoop loop;
    private final ExecutorService worker;
    private final CountDownLatch terminated = new CountDownLatch(1);

    Subscription(ConnectionManager mq, String queueName, String consumerTag, DeliveryLoop loop) {
        this.mq = mq;
        this.queueName = queueName;
        this.consumerTag = consumerTag;
        this.loop = loop;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "rabbilite-consumer-" + queueName);
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        worker.execute(() -> {
            try {
                loop.run();
            } finally {
                terminated.countDown();
            }
        });
        worker.shutdown();
    }

    public String queueName() {
        return queueName;
    }

    public String consumerTag() {
        return consumerTag;
    }

    /** True until the delivery loop has exited. */
    public boolean isActive() {
        return terminated.getCount() > 0;
    }

    /**
     * Asks the broker to stop delivering and lets the loop wind down. Does not wait; use
     * {@link #awaitTermination(Duration)} for that. No-op once the loop has finished.
     *
     * @throws TransportException if the cancel could not be sent on a still-open channel; the subscription then
     *                            stays active and keeps handling deliveries
     */
    public void cancel() {
        if (!isActive()) {
            return;
        }
        loop.requestCancel();
        if (!mq.isConnected()) {
            return;
        }
        boolean sent = false;
        try {
            mq.withChannel(ch -> { ch.basicCancel(consumerTag); return null; });
            sent = true;
            log.info("[MQ] Cancelled consumer {} on {}", consumerTag, queueName);
        } catch (IOException e) {
            throw new TransportException("Cannot cancel consumer " + consumerTag, e);
        } finally {
            if (!sent) {
                // broker keeps delivering, so the loop has to keep handling
                loop.withdrawCancel();
            }
        }
    }

    /** @return true if the loop finished within {@code timeout} */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
