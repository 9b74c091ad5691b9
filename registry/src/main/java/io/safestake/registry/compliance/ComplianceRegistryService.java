package io.safestake.registry.compliance;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.safestake.registry.account.AccountStore;
import io.safestake.registry.account.ComplianceRecord;
import io.safestake.registry.account.DuplicateAccountException;
import io.safestake.registry.attestation.AttestationVerifier;
import io.safestake.registry.config.RegistryProperties;
import io.safestake.registry.eligibility.EligibilityDecision;
import io.safestake.registry.eligibility.EligibilityEngine;
import io.safestake.registry.outbox.ComplianceEventPublisher;
import io.safestake.registry.window.TimeWindowTracker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * The only writer of compliance records.
 *
 * <p>Every mutation takes the account's lock, opens a transaction, re-reads the record and
 * re-checks all of its preconditions before writing. A failed precondition throws
 * {@link RegistryException} and leaves the record exactly as it was. Nothing here retries.
 */
@Service
public class ComplianceRegistryService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceRegistryService.class);
    private static final int MAX_ACCOUNT_ID_LENGTH = 128;
    private static final int MAX_PLATFORM_ID_LENGTH = 128;

    private final AccountStore accountStore;
    private final AttestationVerifier attestationVerifier;
    private final TimeWindowTracker windowTracker;
    private final EligibilityEngine eligibilityEngine;
    private final AccountLockManager lockManager;
    private final TransactionOperations transactionOperations;
    private final ComplianceEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final RegistryProperties properties;
    private final Clock clock;

    public ComplianceRegistryService(
        AccountStore accountStore,
        AttestationVerifier attestationVerifier,
        TimeWindowTracker windowTracker,
        EligibilityEngine eligibilityEngine,
        AccountLockManager lockManager,
        TransactionOperations transactionOperations,
        ComplianceEventPublisher eventPublisher,
        ObjectMapper objectMapper,
        RegistryProperties properties,
        Clock clock
    ) {
        this.accountStore = accountStore;
        this.attestationVerifier = attestationVerifier;
        this.windowTracker = windowTracker;
        this.eligibilityEngine = eligibilityEngine;
        this.lockManager = lockManager;
        this.transactionOperations = transactionOperations;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public ComplianceRecord registerUser(String accountId, byte[] signature) {
        requireAccountId(accountId);
        if (!attestationVerifier.isValid(accountId, signature)) {
            log.warn("Rejected age attestation. accountId={}", accountId);
            throw new RegistryException(RegistryError.INVALID_SIGNATURE, "Age verification signature is invalid");
        }

        return mutate(accountId, () -> {
            if (accountStore.exists(accountId)) {
                throw alreadyRegistered(accountId);
            }
            Instant now = clock.instant();
            ComplianceRecord record = ComplianceRecord.registered(
                accountId,
                now,
                windowTracker.dayBucket(now),
                windowTracker.monthBucket(now),
                properties.getRegistry().getDefaultDailyLimit(),
                properties.getRegistry().getDefaultMonthlyLimit()
            );
            try {
                accountStore.create(record);
            } catch (DuplicateAccountException e) {
                throw alreadyRegistered(accountId);
            }

            eventPublisher.publish(accountId, "UserRegistered", objectMapper.createObjectNode()
                .put("ageVerified", true));
            log.info("User registered. accountId={}", accountId);
            return record;
        });
    }

    public ComplianceRecord setLimits(String accountId, long dailyLimit, long monthlyLimit) {
        requireAccountId(accountId);
        if (dailyLimit <= 0 || monthlyLimit <= 0 || dailyLimit > monthlyLimit) {
            throw new RegistryException(
                RegistryError.INVALID_LIMITS,
                "Limits must be positive and dailyLimit must not exceed monthlyLimit"
            );
        }

        return mutate(accountId, () -> {
            ComplianceRecord record = requireRecord(accountId);
            if (!record.isAgeVerified()) {
                throw new RegistryException(RegistryError.AGE_NOT_VERIFIED, "Age verification required: " + accountId);
            }
            record.setDailyLimit(dailyLimit);
            record.setMonthlyLimit(monthlyLimit);
            record.setUpdatedAt(clock.instant());
            accountStore.save(record);

            eventPublisher.publish(accountId, "LimitsUpdated", objectMapper.createObjectNode()
                .put("dailyLimit", dailyLimit)
                .put("monthlyLimit", monthlyLimit));
            log.info("Limits updated. accountId={} dailyLimit={} monthlyLimit={}", accountId, dailyLimit, monthlyLimit);
            return record;
        });
    }

    public ComplianceRecord recordTransaction(String accountId, long amount, String platformId) {
        requireAccountId(accountId);
        if (amount < 0) {
            throw new RegistryException(RegistryError.INVALID_AMOUNT, "amount must not be negative");
        }
        if (platformId == null || platformId.isBlank() || platformId.length() > MAX_PLATFORM_ID_LENGTH) {
            throw new RegistryException(RegistryError.INVALID_REQUEST, "platformId is required");
        }

        return mutate(accountId, () -> {
            Instant now = clock.instant();
            Optional<ComplianceRecord> maybeRecord = accountStore.find(accountId);
            EligibilityDecision decision = eligibilityEngine.evaluate(maybeRecord, amount, now);
            if (!decision.eligible()) {
                throw new RegistryException(RegistryError.fromEligibility(decision.status()), decision.status().getMessage());
            }

            ComplianceRecord record = maybeRecord.orElseThrow();
            windowTracker.applyResets(record, now);
            record.addSpend(amount, platformId);
            record.setUpdatedAt(now);
            accountStore.save(record);

            eventPublisher.publish(accountId, "TransactionRecorded", objectMapper.createObjectNode()
                .put("amount", amount)
                .put("platformId", platformId)
                .put("dailySpent", record.getDailySpent())
                .put("monthlySpent", record.getMonthlySpent()));
            log.info("Transaction recorded. accountId={} platformId={} amount={} dailySpent={} monthlySpent={}",
                accountId, platformId, amount, record.getDailySpent(), record.getMonthlySpent());
            return record;
        });
    }

    public ComplianceRecord selfExclude(String accountId, int durationDays) {
        requireAccountId(accountId);
        int maxDays = properties.getRegistry().getMaxSelfExclusionDays();
        if (durationDays <= 0 || durationDays > maxDays) {
            throw new RegistryException(RegistryError.INVALID_DURATION, "durationDays must be between 1 and " + maxDays);
        }

        return mutate(accountId, () -> {
            ComplianceRecord record = requireRecord(accountId);
            Instant now = clock.instant();
            if (record.isSelfExcludedAt(now)) {
                throw new RegistryException(
                    RegistryError.ALREADY_EXCLUDED,
                    "Self-exclusion already active until " + record.getSelfExcludedUntil()
                );
            }
            Instant until = now.plus(Duration.ofDays(durationDays));
            record.setSelfExcludedUntil(until);
            record.setUpdatedAt(now);
            accountStore.save(record);

            eventPublisher.publish(accountId, "SelfExcluded", objectMapper.createObjectNode()
                .put("durationDays", durationDays)
                .put("selfExcludedUntil", until.toString()));
            log.info("Self-exclusion started. accountId={} until={}", accountId, until);
            return record;
        });
    }

    public ComplianceRecord startCooldown(String accountId, int durationHours) {
        requireAccountId(accountId);
        int maxHours = properties.getRegistry().getMaxCooldownHours();
        if (durationHours <= 0 || durationHours > maxHours) {
            throw new RegistryException(RegistryError.INVALID_DURATION, "durationHours must be between 1 and " + maxHours);
        }

        return mutate(accountId, () -> {
            ComplianceRecord record = requireRecord(accountId);
            Instant now = clock.instant();
            Instant until = now.plus(Duration.ofHours(durationHours));
            if (record.isOnCooldownAt(now) && record.getCooldownUntil().isAfter(until)) {
                throw new RegistryException(
                    RegistryError.COOLDOWN_ACTIVE,
                    "Cooldown already active until " + record.getCooldownUntil() + " and cannot be shortened"
                );
            }
            record.setCooldownUntil(until);
            record.setUpdatedAt(now);
            accountStore.save(record);

            eventPublisher.publish(accountId, "CooldownStarted", objectMapper.createObjectNode()
                .put("durationHours", durationHours)
                .put("cooldownUntil", until.toString()));
            log.info("Cooldown started. accountId={} until={}", accountId, until);
            return record;
        });
    }

    public EligibilityDecision checkEligibility(String accountId, long proposedAmount) {
        requireAccountId(accountId);
        if (proposedAmount < 0) {
            throw new RegistryException(RegistryError.INVALID_AMOUNT, "amount must not be negative");
        }
        return eligibilityEngine.evaluate(accountStore.find(accountId), proposedAmount, clock.instant());
    }

    public ComplianceView getRecord(String accountId) {
        requireAccountId(accountId);
        ComplianceRecord record = requireRecord(accountId);
        return ComplianceView.of(record, windowTracker.evaluate(record, clock.instant()));
    }

    private <T> T mutate(String accountId, Supplier<T> action) {
        return lockManager.withAccountLock(accountId, () -> {
            try {
                return transactionOperations.execute(status -> action.get());
            } catch (OptimisticLockingFailureException e) {
                log.warn("Concurrent update from another instance. accountId={}", accountId);
                throw new RegistryException(RegistryError.ACCOUNT_BUSY, "Account was modified concurrently: " + accountId);
            }
        });
    }

    private ComplianceRecord requireRecord(String accountId) {
        return accountStore.find(accountId)
            .orElseThrow(() -> new RegistryException(RegistryError.NOT_REGISTERED, "User not registered: " + accountId));
    }

    private static void requireAccountId(String accountId) {
        if (accountId == null || accountId.isBlank() || accountId.length() > MAX_ACCOUNT_ID_LENGTH) {
            throw new RegistryException(RegistryError.INVALID_REQUEST, "accountId is required");
        }
    }

    private static RegistryException alreadyRegistered(String accountId) {
        return new RegistryException(RegistryError.ALREADY_REGISTERED, "User already registered: " + accountId);
    }
}
