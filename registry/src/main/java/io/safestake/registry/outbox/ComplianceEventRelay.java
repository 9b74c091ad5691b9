package io.safestake.registry.outbox;

import io.safestake.registry.config.RegistryProperties;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * The only Kafka sender for compliance events. Each round sends at most one event per account, the
 * oldest unsent one, and waits for the broker ack before the next round may pick that account again.
 */
@Component
public class ComplianceEventRelay {

    private static final Logger log = LoggerFactory.getLogger(ComplianceEventRelay.class);

    private final RegistryProperties properties;
    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String instanceId = UUID.randomUUID().toString();

    public ComplianceEventRelay(
        RegistryProperties properties,
        OutboxRepository outboxRepository,
        KafkaTemplate<String, String> kafkaTemplate
    ) {
        this.properties = properties;
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
    }

    @Scheduled(fixedDelayString = "${safestake.outbox.poll-interval-ms:1000}")
    public void relayPendingEvents() {
        RegistryProperties.Outbox cfg = properties.getOutbox();
        if (!cfg.isKafkaEnabled()) {
            return;
        }

        for (int round = 0; round < cfg.getMaxRoundsPerPoll(); round++) {
            List<UUID> claimed = outboxRepository.claimAccountHeads(instanceId);
            if (claimed.isEmpty()) {
                return;
            }
            for (int i = 0; i < claimed.size(); i++) {
                if (!send(claimed.get(i), cfg)) {
                    claimed.subList(i + 1, claimed.size()).forEach(outboxRepository::unlock);
                    return;
                }
            }
        }
    }

    // false only when interrupted; a failed send is recorded and the round goes on
    private boolean send(UUID eventId, RegistryProperties.Outbox cfg) {
        Optional<OutboxEventRow> eventOpt = outboxRepository.findEvent(eventId);
        if (eventOpt.isEmpty()) {
            outboxRepository.unlock(eventId);
            return true;
        }

        OutboxEventRow event = eventOpt.get();
        try {
            // send happens outside any DB transaction; the row lock is only the claim marker
            kafkaTemplate.send(event.topic(), event.partitionKey(), event.payload().toString()).get();
            outboxRepository.markSendSuccess(eventId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxRepository.unlock(eventId);
            return false;
        } catch (Exception e) {
            log.warn("Publish failed for compliance event {} accountId={}", eventId, event.partitionKey(), e);
            outboxRepository.markSendFail(eventId, e.getMessage(), Duration.ofSeconds(cfg.getBackoffSeconds()));
            if (event.attemptCount() + 1 >= cfg.getMaxAttempts()) {
                log.error("Compliance event {} exhausted {} attempts; later events for accountId={} are held back",
                    eventId, cfg.getMaxAttempts(), event.partitionKey());
            }
        }
        return true;
    }
}
