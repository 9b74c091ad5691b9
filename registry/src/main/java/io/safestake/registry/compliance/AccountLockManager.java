package io.safestake.registry.compliance;

import io.safestake.registry.config.RegistryProperties;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Serializes writers per account. Accounts are hashed onto a fixed set of lock stripes, so two
 * accounts may share a stripe but one account always maps to the same one. Waiting is bounded by
 * {@code safestake.registry.lock-timeout-ms}.
 */
@Component
public class AccountLockManager {

    @FunctionalInterface
    public interface LockedCallback<T> {
        T run();
    }

    private final ReentrantLock[] stripes;
    private final long timeoutMs;

    @Autowired
    public AccountLockManager(RegistryProperties properties) {
        this(properties.getRegistry().getLockStripes(), properties.getRegistry().getLockTimeoutMs());
    }

    public AccountLockManager(int stripeCount, long timeoutMs) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.timeoutMs = timeoutMs;
    }

    public <T> T withAccountLock(String accountId, LockedCallback<T> callback) {
        ReentrantLock lock = stripeFor(accountId);
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(RegistryError.ACCOUNT_BUSY, "Interrupted while waiting for account " + accountId);
        }
        if (!acquired) {
            throw new RegistryException(RegistryError.ACCOUNT_BUSY, "Account is busy: " + accountId);
        }
        try {
            return callback.run();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock stripeFor(String accountId) {
        return stripes[Math.floorMod(accountId.hashCode(), stripes.length)];
    }
}
