package io.safestake.registry.outbox;

public enum OutboxDeliveryStatus {
    INIT,
    SEND_SUCCESS,
    SEND_FAIL
}
