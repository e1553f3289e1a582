package com.rabbilite.core.it;

import com.rabbilite.core.connection.ConnectionManager;
import com.rabbilite.core.consumer.MessageConsumer;
import com.rabbilite.core.consumer.RedeliveryPolicy;
import com.rabbilite.core.consumer.Subscription;
import com.rabbilite.core.error.TopologyException;
import com.rabbilite.core.json.JsonUtils;
import com.rabbilite.core.producer.MessageProducer;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end behaviour against a real RabbitMQ broker. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class BrokerRoundTripTest {

    @Container
    private static final RabbitMQContainer rabbit =
            new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.13-management-alpine"));

    private final List<AutoCloseable> clients = new ArrayList<>();

    @AfterEach
    void closeClients() throws Exception {
        Collections.reverse(clients);
        for (AutoCloseable c : clients) c.close();
    }

    private static String url() {
        return rabbit.getAmqpUrl();
    }

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    private MessageProducer producer() {
        MessageProducer p = new MessageProducer(url());
        clients.add(p);
        return p;
    }

    private MessageConsumer consumer() {
        MessageConsumer c = new MessageConsumer(url());
        clients.add(c);
        return c;
    }

    private static Map<String, Object> job() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", 1);
        m.put("val", "a");
        return m;
    }

    @Test
    void sentMessageArrivesAsJsonAndIsAckedOnce() throws Exception {
        String queue = unique("jobs");
        List<byte[]> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch got = new CountDownLatch(1);

        consumer().startConsuming(queue, body -> {
            seen.add(body);
            got.countDown();
        });
        producer().sendMessage(queue, job());

        assertThat(got.await(10, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(500);
        assertThat(seen).hasSize(1);
        assertThat(new String(seen.get(0), StandardCharsets.UTF_8)).isEqualTo("{\"id\":1,\"val\":\"a\"}");
        assertThat(JsonUtils.fromBytes(seen.get(0), Map.class)).isEqualTo(job());
        assertThat(messageCount(queue)).isZero();
    }

    @Test
    void failedOnceIsRedeliveredThenAcked() throws Exception {
        String queue = unique("jobs");
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch twice = new CountDownLatch(2);

        consumer().startConsuming(queue, body -> {
            seen.add(new String(body, StandardCharsets.UTF_8));
            twice.countDown();
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("first attempt fails");
        });
        producer().sendMessage(queue, job());

        assertThat(twice.await(10, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(500);
        assertThat(seen).containsExactly("{\"id\":1,\"val\":\"a\"}", "{\"id\":1,\"val\":\"a\"}");
        assertThat(messageCount(queue)).isZero();
    }

    @Test
    void fanoutDeliversOneCopyPerConnectedSubscriber() throws Exception {
        String exchange = unique("news");
        int subscribers = 3;
        CountDownLatch all = new CountDownLatch(subscribers);
        List<AtomicInteger> counts = new ArrayList<>();
        for (int i = 0; i < subscribers; i++) {
            AtomicInteger n = new AtomicInteger();
            counts.add(n);
            consumer().startConsumingFromFanout(exchange, body -> {
                n.incrementAndGet();
                all.countDown();
            });
        }

        producer().broadcast(exchange, job());

        assertThat(all.await(10, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(500);
        assertThat(counts).allSatisfy(n -> assertThat(n.get()).isEqualTo(1));
    }

    @Test
    void lateFanoutSubscriberReceivesNothingFromEarlierPublish() throws Exception {
        String exchange = unique("news");
        MessageProducer producer = producer();
        producer.broadcast(exchange, job());

        AtomicInteger late = new AtomicInteger();
        consumer().startConsumingFromFanout(exchange, body -> late.incrementAndGet());
        Thread.sleep(1000);

        assertThat(late.get()).isZero();
    }

    @Test
    void repeatedSendsToSameQueueDeclareIdempotently() {
        String queue = unique("jobs");
        MessageProducer producer = producer();

        producer.sendMessage(queue, job());
        producer.sendMessage(queue, job());

        assertThat(producer.isConnected()).isTrue();
    }

    @Test
    void conflictingQueuePropertiesFailStartup() throws Exception {
        String queue = unique("transient");
        try (Connection conn = rawConnection(); Channel ch = conn.createChannel()) {
            ch.queueDeclare(queue, false, false, false, null);
        }

        assertThatThrownBy(() -> producer().sendMessage(queue, job())).isInstanceOf(TopologyException.class);
    }

    @Test
    void exhaustedRedeliveriesAreParked() throws Exception {
        String queue = unique("jobs");
        MessageConsumer c = new MessageConsumer(
                ConnectionManager.open(url()),
                RedeliveryPolicy.limited(2, RedeliveryPolicy.ExhaustedAction.PARK));
        clients.add(c);
        AtomicInteger calls = new AtomicInteger();
        c.startConsuming(queue, body -> {
            calls.incrementAndGet();
            throw new IllegalStateException("poison");
        });

        producer().sendMessage(queue, job());

        long deadline = System.currentTimeMillis() + 10_000;
        while (messageCount(queue + ".parking") < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(100);
        }
        assertThat(messageCount(queue + ".parking")).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void cancelStopsConsumingButKeepsConnection() throws Exception {
        String queue = unique("jobs");
        MessageConsumer c = consumer();
        AtomicInteger calls = new AtomicInteger();
        Subscription s = c.startConsuming(queue, body -> calls.incrementAndGet());

        s.cancel();
        assertThat(s.awaitTermination(Duration.ofSeconds(5))).isTrue();
        producer().sendMessage(queue, job());
        Thread.sleep(500);

        assertThat(calls.get()).isZero();
        assertThat(c.isConnected()).isTrue();
        assertThat(messageCount(queue)).isEqualTo(1);
    }

    @Test
    void livenessFlipsOnClose() {
        MessageConsumer c = new MessageConsumer(url());
        assertThat(c.isConnected()).isTrue();

        c.close();

        assertThat(c.isConnected()).isFalse();
    }

    private static Connection rawConnection() throws Exception {
        ConnectionFactory f = new ConnectionFactory();
        f.setUri(url());
        return f.newConnection();
    }

    /** Ready messages in {@code queue}; 0 while the queue does not exist yet. */
    private static long messageCount(String queue) throws Exception {
        try (Connection conn = rawConnection()) {
            Channel ch = conn.createChannel();
            try {
                return ch.queueDeclarePassive(queue).getMessageCount();
            } catch (IOException e) {
                return 0;
            }
        }
    }
}
