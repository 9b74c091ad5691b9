package io.safestake.registry.outbox;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.safestake.registry.config.RegistryProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Records a compliance event in the caller's transaction. The row commits or rolls back with the
 * mutation that raised it; {@link ComplianceEventRelay} ships it to Kafka afterwards.
 */
@Component
public class ComplianceEventPublisher {

    private final OutboxRepository outboxRepository;
    private final RegistryProperties properties;
    private final Clock clock;

    public ComplianceEventPublisher(OutboxRepository outboxRepository, RegistryProperties properties, Clock clock) {
        this.outboxRepository = outboxRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public void publish(String accountId, String eventType, ObjectNode payload) {
        UUID eventId = UUID.randomUUID();
        Instant occurredAt = clock.instant();
        payload.put("eventId", eventId.toString())
            .put("eventType", eventType)
            .put("accountId", accountId)
            .put("occurredAt", occurredAt.toString());
        outboxRepository.insert(new ComplianceEvent(
            eventId,
            accountId,
            eventType,
            occurredAt,
            properties.getOutbox().getTopic(),
            payload
        ));
    }
}
