package io.safestake.registry.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

public record ComplianceEvent(
    UUID eventId,
    String accountId,
    String eventType,
    Instant occurredAt,
    String topic,
    JsonNode payload
) {
}
