package io.safestake.registry.account;

import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "safestake.registry", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaAccountStore implements AccountStore {

    private final ComplianceRecordRepository repository;

    public JpaAccountStore(ComplianceRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<ComplianceRecord> find(String accountId) {
        return repository.findById(accountId);
    }

    @Override
    public boolean exists(String accountId) {
        return repository.existsById(accountId);
    }

    @Override
    public ComplianceRecord create(ComplianceRecord record) {
        if (repository.existsById(record.getAccountId())) {
            throw new DuplicateAccountException(record.getAccountId(), null);
        }
        try {
            return repository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            // another instance inserted between the check and the flush
            throw new DuplicateAccountException(record.getAccountId(), e);
        }
    }

    @Override
    public ComplianceRecord save(ComplianceRecord record) {
        return repository.saveAndFlush(record);
    }
}
