package io.safestake.registry.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.UUID;

public record OutboxEventRow(
    UUID eventId,
    String topic,
    String partitionKey,
    JsonNode payload,
    int attemptCount
) {
}
