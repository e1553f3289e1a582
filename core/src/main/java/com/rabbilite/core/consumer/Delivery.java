package com.rabbilite.core.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

/** One message pushed by the broker, still waiting for its ack decision. */
public final class Delivery {
    private final Envelope envelope;
    private final AMQP.BasicProperties props;
    private final byte[] body;

    public Delivery(Envelope envelope, AMQP.BasicProperties props, byte[] body) {
        this.envelope = envelope;
        this.props = props;
        this.body = body;
    }

    public long deliveryTag() { return envelope.getDeliveryTag(); }
    public boolean redelivered() { return envelope.isRedeliver(); }
    public Envelope envelope() { return envelope; }
    public AMQP.BasicProperties props() { return props; }
    public byte[] body() { return body; }

    /** Broker-side delivery count (quorum queues only), or -1 when the header is absent. */
    public long brokerDeliveryCount() {
        if (props == null || props.getHeaders() == null) return -1;
        Object v = props.getHeaders().get("x-delivery-count");
        return v instanceof Number ? ((Number) v).longValue() : -1;
    }
}
