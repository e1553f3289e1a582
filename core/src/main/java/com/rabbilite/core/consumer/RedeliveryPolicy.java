package com.rabbilite.core.consumer;

import java.util.Objects;

/**
 * What to do with a delivery whose handler failed. {@link #unlimited()} requeues forever; a limited policy
 * gives up after {@code maxAttempts} handler invocations of the same message.
 */
public final class RedeliveryPolicy {

    public enum ExhaustedAction { REJECT, PARK }

    public static final String PARKING_SUFFIX = ".parking";

    private static final RedeliveryPolicy UNLIMITED = new RedeliveryPolicy(0, ExhaustedAction.REJECT);

    private final int maxAttempts;
    private final ExhaustedAction exhaustedAction;

    private RedeliveryPolicy(int maxAttempts, ExhaustedAction exhaustedAction) {
        this.maxAttempts = maxAttempts;
        this.exhaustedAction = exhaustedAction;
    }

    public static RedeliveryPolicy unlimited() {
        return UNLIMITED;
    }

    public static RedeliveryPolicy limited(int maxAttempts, ExhaustedAction action) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        return new RedeliveryPolicy(maxAttempts, Objects.requireNonNull(action, "action"));
    }

    public boolean isUnlimited() {
        return maxAttempts == 0;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public ExhaustedAction exhaustedAction() {
        return exhaustedAction;
    }

    /** @param attempts handler invocations so far for this message, including the one that just failed */
    public AckDecision onFailure(long attempts) {
        if (isUnlimited() || attempts < maxAttempts) {
            return AckDecision.NACK_REQUEUE;
        }
        return exhaustedAction == ExhaustedAction.PARK ? AckDecision.PARK : AckDecision.REJECT;
    }

    public static String parkingQueueFor(String queueName) {
        return queueName + PARKING_SUFFIX;
    }

    @Override
    public String toString() {
        return isUnlimited() ? "unlimited" : maxAttempts + " attempts then " + exhaustedAction;
    }
}
