package io.safestake.registry.compliance;

import io.safestake.registry.account.ComplianceRecord;
import io.safestake.registry.window.WindowState;
import java.time.Instant;
import java.util.List;

/**
 * Read-only projection of a record as of the query time. Pending window resets are reflected in
 * the spend figures but not written back.
 */
public record ComplianceView(
    String accountId,
    boolean ageVerified,
    long dailyLimit,
    long monthlyLimit,
    long dailySpent,
    long monthlySpent,
    long remainingDailyLimit,
    long remainingMonthlyLimit,
    long lastResetDay,
    long lastResetMonth,
    Instant cooldownUntil,
    Instant selfExcludedUntil,
    List<String> platformsUsed,
    Instant registeredAt
) {

    static ComplianceView of(ComplianceRecord record, WindowState window) {
        return new ComplianceView(
            record.getAccountId(),
            record.isAgeVerified(),
            record.getDailyLimit(),
            record.getMonthlyLimit(),
            window.dailySpent(),
            window.monthlySpent(),
            Math.max(0L, record.getDailyLimit() - window.dailySpent()),
            Math.max(0L, record.getMonthlyLimit() - window.monthlySpent()),
            window.dayBucket(),
            window.monthBucket(),
            record.getCooldownUntil(),
            record.getSelfExcludedUntil(),
            record.getPlatformsUsed().stream().sorted().toList(),
            record.getRegisteredAt()
        );
    }
}
