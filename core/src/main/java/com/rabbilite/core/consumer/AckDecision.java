package com.rabbilite.core.consumer;

/** Terminal state of a delivery. Exactly one is applied per delivery. */
public enum AckDecision {
    /** basic.ack: handled, removed from the queue. */
    ACK,
    /** basic.nack with requeue: goes back to the queue for another attempt. */
    NACK_REQUEUE,
    /** basic.reject without requeue: dropped, or dead-lettered if the queue has a DLX. */
    REJECT,
    /** Copied to the parking queue, then acked. */
    PARK
}
