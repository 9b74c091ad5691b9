package io.safestake.registry.account;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Map-backed store for tests and single-node demos. Records are copied on the way in and out so a
 * caller's uncommitted edits never leak to concurrent readers.
 *
 * <p>Inside a Spring-managed transaction a write is held back until commit and dropped on rollback,
 * so it stays atomic with the outbox row written in the same transaction. Outside one it applies
 * immediately. Callers serialize writes per account.
 */
@Component
@ConditionalOnProperty(prefix = "safestake.registry", name = "store", havingValue = "memory")
public class InMemoryAccountStore implements AccountStore {

    private final ConcurrentMap<String, ComplianceRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ComplianceRecord> find(String accountId) {
        return Optional.ofNullable(records.get(accountId)).map(ComplianceRecord::copy);
    }

    @Override
    public boolean exists(String accountId) {
        return records.containsKey(accountId);
    }

    @Override
    public ComplianceRecord create(ComplianceRecord record) {
        String accountId = record.getAccountId();
        ComplianceRecord snapshot = record.copy();
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            if (records.putIfAbsent(accountId, snapshot) != null) {
                throw new DuplicateAccountException(accountId, null);
            }
            return record;
        }
        if (records.containsKey(accountId)) {
            throw new DuplicateAccountException(accountId, null);
        }
        afterCommit(() -> records.putIfAbsent(accountId, snapshot));
        return record;
    }

    @Override
    public ComplianceRecord save(ComplianceRecord record) {
        ComplianceRecord snapshot = record.copy();
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            records.put(snapshot.getAccountId(), snapshot);
            return record;
        }
        afterCommit(() -> records.put(snapshot.getAccountId(), snapshot));
        return record;
    }

    private static void afterCommit(Runnable write) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                write.run();
            }
        });
    }
}
