package io.safestake.registry.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.safestake.registry.config.RegistryProperties;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OutboxRepository {

    private static final Duration LOCK_TTL = Duration.ofMinutes(5);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RegistryProperties properties;
    private final Clock clock;

    public OutboxRepository(
        NamedParameterJdbcTemplate jdbcTemplate,
        ObjectMapper objectMapper,
        RegistryProperties properties,
        Clock clock
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public void insert(ComplianceEvent event) {
        String sql = """
            INSERT INTO compliance_event(event_id, account_id, event_type, payload, topic, partition_key,
                                         occurred_at, status, attempt_count, updated_at)
            VALUES (:eventId, :accountId, :eventType, :payload, :topic, :partitionKey,
                    :occurredAt, :status, 0, :occurredAt)
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("eventId", event.eventId())
            .addValue("accountId", event.accountId())
            .addValue("eventType", event.eventType())
            .addValue("payload", event.payload().toString())
            .addValue("topic", event.topic())
            .addValue("partitionKey", event.accountId())
            .addValue("occurredAt", Timestamp.from(event.occurredAt()))
            .addValue("status", OutboxDeliveryStatus.INIT.name()));
    }

    public Optional<OutboxEventRow> findEvent(UUID eventId) {
        String sql = """
            SELECT event_id, topic, partition_key, payload, attempt_count
            FROM compliance_event
            WHERE event_id = :eventId
            """;
        List<OutboxEventRow> rows = jdbcTemplate.query(sql, Map.of("eventId", eventId), this::toOutboxEventRow);
        return rows.stream().findFirst();
    }

    public List<String> findEventTypes(String accountId) {
        String sql = """
            SELECT event_type
            FROM compliance_event
            WHERE account_id = :accountId
            ORDER BY event_seq ASC
            """;
        return jdbcTemplate.queryForList(sql, Map.of("accountId", accountId), String.class);
    }

    public void markSendSuccess(UUID eventId) {
        String sql = """
            UPDATE compliance_event
            SET status = :status,
                sent_at = :now,
                locked_by = null,
                locked_at = null,
                updated_at = :now
            WHERE event_id = :eventId
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("status", OutboxDeliveryStatus.SEND_SUCCESS.name())
            .addValue("now", now()));
    }

    public void markSendFail(UUID eventId, String error, Duration backoff) {
        String sql = """
            UPDATE compliance_event
            SET status = :status,
                attempt_count = attempt_count + 1,
                last_error = :lastError,
                next_retry_at = :nextRetryAt,
                locked_by = null,
                locked_at = null,
                updated_at = :now
            WHERE event_id = :eventId
            """;
        Instant now = clock.instant();
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("status", OutboxDeliveryStatus.SEND_FAIL.name())
            .addValue("lastError", truncate(error))
            .addValue("nextRetryAt", Timestamp.from(now.plus(backoff)))
            .addValue("now", Timestamp.from(now)));
    }

    /**
     * Claims the oldest unsent event of each account, provided it is due. Later events of an account
     * stay unclaimable until every earlier one is marked sent, so a failing or exhausted event holds
     * back the rest of that account's stream instead of letting it overtake.
     */
    public List<UUID> claimAccountHeads(String instanceId) {
        RegistryProperties.Outbox cfg = properties.getOutbox();
        Instant now = clock.instant();

        String candidateSql = """
            SELECT e.event_id
            FROM compliance_event e
            WHERE e.status <> 'SEND_SUCCESS'
              AND e.attempt_count < :maxAttempts
              AND (e.next_retry_at IS NULL OR e.next_retry_at <= :now)
              AND (e.locked_at IS NULL OR e.locked_at <= :lockExpiry)
              AND NOT EXISTS (
                  SELECT 1
                  FROM compliance_event earlier
                  WHERE earlier.account_id = e.account_id
                    AND earlier.status <> 'SEND_SUCCESS'
                    AND earlier.event_seq < e.event_seq
              )
            ORDER BY e.event_seq ASC
            LIMIT :batchSize
            """;
        List<UUID> candidates = jdbcTemplate.queryForList(candidateSql, new MapSqlParameterSource()
            .addValue("maxAttempts", cfg.getMaxAttempts())
            .addValue("now", Timestamp.from(now))
            .addValue("lockExpiry", Timestamp.from(now.minus(LOCK_TTL)))
            .addValue("batchSize", cfg.getClaimBatchSize()), UUID.class);

        if (candidates.isEmpty()) {
            return List.of();
        }

        String claimSql = """
            UPDATE compliance_event
            SET locked_by = :lockedBy,
                locked_at = :now,
                updated_at = :now
            WHERE event_id = :eventId
              AND status <> 'SEND_SUCCESS'
              AND (locked_at IS NULL OR locked_at <= :lockExpiry)
            """;
        List<UUID> claimed = new ArrayList<>();
        for (UUID eventId : candidates) {
            int updated = jdbcTemplate.update(claimSql, new MapSqlParameterSource()
                .addValue("lockedBy", instanceId)
                .addValue("eventId", eventId)
                .addValue("now", Timestamp.from(now))
                .addValue("lockExpiry", Timestamp.from(now.minus(LOCK_TTL))));
            if (updated == 1) {
                claimed.add(eventId);
            }
        }
        return claimed;
    }

    public void unlock(UUID eventId) {
        String sql = """
            UPDATE compliance_event
            SET locked_by = null,
                locked_at = null,
                updated_at = :now
            WHERE event_id = :eventId
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("now", now()));
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > 1000 ? error.substring(0, 1000) : error;
    }

    private OutboxEventRow toOutboxEventRow(ResultSet rs, int rowNum) throws SQLException {
        String payloadText = rs.getString("payload");
        JsonNode payload;
        try {
            payload = objectMapper.readTree(payloadText);
        } catch (Exception e) {
            payload = objectMapper.createObjectNode().put("raw", payloadText);
        }
        return new OutboxEventRow(
            rs.getObject("event_id", UUID.class),
            rs.getString("topic"),
            rs.getString("partition_key"),
            payload,
            rs.getInt("attempt_count")
        );
    }
}
