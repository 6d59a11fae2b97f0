package com.postqueue.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Proof of a successful delivery as reported by the transport.
 */
public final class DeliveryReceipt {
    private final String messageId;
    private final Instant deliveredAt;

    public DeliveryReceipt(String messageId, Instant deliveredAt) {
        this.messageId = Objects.requireNonNull(messageId, "messageId");
        this.deliveredAt = deliveredAt;
    }

    public String getMessageId() {
        return messageId;
    }

    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    @Override
    public String toString() {
        return "DeliveryReceipt{messageId='" + messageId + "'}";
    }
}
