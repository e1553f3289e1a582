package com.rabbilite.core.producer;

import com.rabbilite.core.config.RabbitConfig;
import com.rabbilite.core.connection.ConnectionManager;
import com.rabbilite.core.error.TopologyException;
import com.rabbilite.core.error.TransportException;
import com.rabbilite.core.json.JsonUtils;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.MessageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Publishes JSON messages to durable work queues, or to fanout exchanges for broadcast.
 *
 * <p>By default a successful send only means the channel accepted the frame. With
 * {@code producer.publisherConfirms=true} every publish also waits for the broker's confirm.
 */
public class MessageProducer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageProducer.class);

    private final ConnectionManager mq;
    private final boolean confirms;
    private final long confirmTimeoutMs;

    public MessageProducer(String url) {
        this(ConnectionManager.open(url));
    }

    public MessageProducer(RabbitConfig cfg) {
        this(ConnectionManager.open(cfg));
    }

    public MessageProducer(ConnectionManager mq) {
        this.mq = mq;
        this.confirms = mq.config().publisherConfirms;
        this.confirmTimeoutMs = mq.config().confirmTimeoutMs;
        if (confirms) {
            try {
                mq.withChannel(ch -> ch.confirmSelect());
            } catch (IOException e) {
                throw new TransportException("Cannot enable publisher confirms", e);
            }
        }
    }

    /**
     * Declares {@code queueName} (durable, non-exclusive, kept when unused), encodes {@code message} as
     * JSON and publishes it persistently through the default exchange.
     *
     * @throws TopologyException        if the queue exists with different properties
     * @throws com.rabbilite.core.error.SerializationException if the value has no JSON form; nothing is sent
     * @throws TransportException       if the channel is closed, the publish fails or a confirm is negative
     */
    public void sendMessage(String queueName, Object message) {
        declareQueue(queueName);
        byte[] body = JsonUtils.toBytes(message);
        publish("", queueName, body);
        log.info("[PUBLISH] queue={} bytes={}", queueName, body.length);
        if (log.isDebugEnabled()) {
            log.debug("[PUBLISH] queue={} body={}", queueName, new String(body, StandardCharsets.UTF_8));
        }
    }

    /**
     * Declares a durable fanout exchange and publishes {@code message} to it. Only consumers subscribed at
     * this moment receive a copy.
     */
    public void broadcast(String exchangeName, Object message) {
        try {
            mq.withChannel(ch -> ch.exchangeDeclare(exchangeName, BuiltinExchangeType.FANOUT, true));
        } catch (IOException e) {
            throw new TopologyException("Cannot declare fanout exchange " + exchangeName, e);
        }
        byte[] body = JsonUtils.toBytes(message);
        publish(exchangeName, "", body);
        log.info("[PUBLISH] exchange={} bytes={}", exchangeName, body.length);
    }

    private void declareQueue(String queueName) {
        try {
            mq.withChannel(ch -> ch.queueDeclare(queueName, true, false, false, null));
        } catch (IOException e) {
            throw new TopologyException("Cannot declare queue " + queueName, e);
        }
    }

    private void publish(String exchange, String routingKey, byte[] body) {
        AMQP.BasicProperties props = MessageProperties.MINIMAL_PERSISTENT_BASIC.builder()
                .contentType(JsonUtils.CONTENT_TYPE)
                .contentEncoding(StandardCharsets.UTF_8.name())
                .messageId(UUID.randomUUID().toString())
                .timestamp(new Date())
                .build();
        try {
            mq.withChannel(ch -> {
                ch.basicPublish(exchange, routingKey, false, props, body);
                if (confirms) {
                    try {
                        ch.waitForConfirmsOrDie(confirmTimeoutMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new TransportException("Interrupted while waiting for publisher confirm", e);
                    } catch (TimeoutException e) {
                        throw new TransportException("No publisher confirm within " + confirmTimeoutMs + "ms", e);
                    }
                }
                return null;
            });
        } catch (IOException e) {
            throw new TransportException("Publish to " + (exchange.isEmpty() ? routingKey : exchange) + " failed", e);
        }
    }

    public boolean isConnected() {
        return mq.isConnected();
    }

    @Override
    public void close() {
        mq.close();
    }
}
