package io.safestake.registry.account;

import java.util.Optional;

/**
 * Durable account id to {@link ComplianceRecord} mapping. Implementations hand out records that the
 * caller may mutate and then pass back to {@link #save}; nothing is visible to other readers before that.
 */
public interface AccountStore {

    Optional<ComplianceRecord> find(String accountId);

    boolean exists(String accountId);

    /**
     * Inserts a new record.
     *
     * @throws DuplicateAccountException if a record already exists for the account
     */
    ComplianceRecord create(ComplianceRecord record);

    ComplianceRecord save(ComplianceRecord record);
}
