package com.rabbilite.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.rabbilite.core.config.RabbitConfig;
import com.rabbilite.core.consumer.MessageConsumer;
import com.rabbilite.core.consumer.Subscription;
import com.rabbilite.core.json.JsonUtils;
import com.rabbilite.core.producer.MessageProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line front end.
 * <pre>
 *   send      &lt;queue&gt;    &lt;json&gt;
 *   broadcast &lt;exchange&gt; &lt;json&gt;
 *   consume   &lt;queue&gt;
 *   subscribe &lt;exchange&gt;
 * </pre>
 * Broker settings come from {@code rabbilite.properties}, env vars or {@code -D} properties.
 */
public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String USAGE = "usage: App (send <queue> <json> | broadcast <exchange> <json>"
            + " | consume <queue> | subscribe <exchange>)";

    public static void main(String[] args) {
        try {
            Command cmd = Command.parse(args);
            RabbitConfig cfg = RabbitConfig.load();
            log.info("[CONF] {}", cfg);
            if (cmd.isPublish()) {
                publish(cmd, cfg);
            } else {
                consumeForever(cmd, cfg);
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Throwable t) {
            log.error("Fatal error in App.main", t);
            System.exit(1);
        }
    }

    static void publish(Command cmd, RabbitConfig cfg) throws Exception {
        JsonNode value = JsonUtils.M.readTree(cmd.payload());
        try (MessageProducer producer = new MessageProducer(cfg)) {
            if (cmd.verb() == Command.Verb.SEND) {
                producer.sendMessage(cmd.target(), value);
            } else {
                producer.broadcast(cmd.target(), value);
            }
        }
    }

    static void consumeForever(Command cmd, RabbitConfig cfg) throws InterruptedException {
        // not try-with-resources: the connection must outlive main's setup
        MessageConsumer consumer = new MessageConsumer(cfg);
        Subscription sub;
        if (cmd.verb() == Command.Verb.CONSUME) {
            sub = consumer.startConsuming(cmd.target(), App::logPayload);
        } else {
            sub = consumer.startConsumingFromFanout(cmd.target(), App::logPayload);
        }

        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received. Cancelling {} and closing MQ...", sub.consumerTag());
            try {
                consumer.close();
            } catch (Exception e) {
                log.warn("Error while closing MQ", e);
            }
            done.countDown();
            log.info("Shutdown complete.");
        }));
        done.await();
    }

    private static void logPayload(byte[] payload) {
        log.info("[RECV] {}", new String(payload, StandardCharsets.UTF_8));
    }
}
