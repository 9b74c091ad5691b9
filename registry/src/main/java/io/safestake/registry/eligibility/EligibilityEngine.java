package io.safestake.registry.eligibility;

import io.safestake.registry.account.ComplianceRecord;
import io.safestake.registry.window.TimeWindowTracker;
import io.safestake.registry.window.WindowState;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Pure eligibility decision. The first matching rule wins, in the order declared by
 * {@link EligibilityStatus}; the record is never modified.
 */
@Component
public class EligibilityEngine {

    private final TimeWindowTracker windowTracker;

    public EligibilityEngine(TimeWindowTracker windowTracker) {
        this.windowTracker = windowTracker;
    }

    public EligibilityDecision evaluate(Optional<ComplianceRecord> maybeRecord, long proposedAmount, Instant now) {
        if (proposedAmount < 0) {
            throw new IllegalArgumentException("proposedAmount must not be negative");
        }
        if (maybeRecord.isEmpty()) {
            return EligibilityDecision.notRegistered();
        }
        ComplianceRecord record = maybeRecord.get();
        WindowState window = windowTracker.evaluate(record, now);
        long remainingDaily = remaining(record.getDailyLimit(), window.dailySpent());
        long remainingMonthly = remaining(record.getMonthlyLimit(), window.monthlySpent());

        return new EligibilityDecision(status(record, window, proposedAmount, now), remainingDaily, remainingMonthly);
    }

    private EligibilityStatus status(ComplianceRecord record, WindowState window, long amount, Instant now) {
        if (!record.isAgeVerified()) {
            return EligibilityStatus.AGE_NOT_VERIFIED;
        }
        if (record.isSelfExcludedAt(now)) {
            return EligibilityStatus.SELF_EXCLUDED;
        }
        if (record.isOnCooldownAt(now)) {
            return EligibilityStatus.ON_COOLDOWN;
        }
        // limit - spent cannot overflow: both are non-negative
        if (amount > record.getDailyLimit() - window.dailySpent()) {
            return EligibilityStatus.DAILY_LIMIT_REACHED;
        }
        if (amount > record.getMonthlyLimit() - window.monthlySpent()) {
            return EligibilityStatus.MONTHLY_LIMIT_REACHED;
        }
        return EligibilityStatus.ELIGIBLE;
    }

    // spent can exceed the limit after the user lowers it mid-window
    private static long remaining(long limit, long spent) {
        return Math.max(0L, limit - spent);
    }
}
