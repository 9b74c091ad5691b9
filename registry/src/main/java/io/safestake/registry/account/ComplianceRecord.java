package io.safestake.registry.account;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-account compliance state. Amounts are in the smallest currency unit; window fields hold
 * bucket indexes produced by {@link io.safestake.registry.window.TimeWindowTracker}.
 */
@Entity
@Table(name = "compliance_record")
public class ComplianceRecord {

    @Id
    @Column(name = "account_id", nullable = false, length = 128)
    private String accountId;

    @Column(name = "age_verified", nullable = false)
    private boolean ageVerified;

    @Column(name = "daily_limit", nullable = false)
    private long dailyLimit;

    @Column(name = "monthly_limit", nullable = false)
    private long monthlyLimit;

    @Column(name = "daily_spent", nullable = false)
    private long dailySpent;

    @Column(name = "monthly_spent", nullable = false)
    private long monthlySpent;

    @Column(name = "last_reset_day", nullable = false)
    private long lastResetDay;

    @Column(name = "last_reset_month", nullable = false)
    private long lastResetMonth;

    @Column(name = "cooldown_until")
    private Instant cooldownUntil;

    @Column(name = "self_excluded_until")
    private Instant selfExcludedUntil;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "compliance_record_platform", joinColumns = @JoinColumn(name = "account_id"))
    @Column(name = "platform_id", nullable = false, length = 128)
    private Set<String> platformsUsed = new HashSet<>();

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public static ComplianceRecord registered(String accountId, Instant now, long dayBucket, long monthBucket,
                                              long dailyLimit, long monthlyLimit) {
        ComplianceRecord record = new ComplianceRecord();
        record.accountId = accountId;
        record.ageVerified = true;
        record.dailyLimit = dailyLimit;
        record.monthlyLimit = monthlyLimit;
        record.lastResetDay = dayBucket;
        record.lastResetMonth = monthBucket;
        record.registeredAt = now;
        record.updatedAt = now;
        return record;
    }

    public ComplianceRecord copy() {
        ComplianceRecord copy = new ComplianceRecord();
        copy.accountId = accountId;
        copy.ageVerified = ageVerified;
        copy.dailyLimit = dailyLimit;
        copy.monthlyLimit = monthlyLimit;
        copy.dailySpent = dailySpent;
        copy.monthlySpent = monthlySpent;
        copy.lastResetDay = lastResetDay;
        copy.lastResetMonth = lastResetMonth;
        copy.cooldownUntil = cooldownUntil;
        copy.selfExcludedUntil = selfExcludedUntil;
        copy.platformsUsed = new HashSet<>(platformsUsed);
        copy.registeredAt = registeredAt;
        copy.updatedAt = updatedAt;
        copy.version = version;
        return copy;
    }

    public boolean isSelfExcludedAt(Instant now) {
        return selfExcludedUntil != null && selfExcludedUntil.isAfter(now);
    }

    public boolean isOnCooldownAt(Instant now) {
        return cooldownUntil != null && cooldownUntil.isAfter(now);
    }

    public void addSpend(long amount, String platformId) {
        dailySpent += amount;
        monthlySpent += amount;
        platformsUsed.add(platformId);
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public boolean isAgeVerified() {
        return ageVerified;
    }

    public void setAgeVerified(boolean ageVerified) {
        this.ageVerified = ageVerified;
    }

    public long getDailyLimit() {
        return dailyLimit;
    }

    public void setDailyLimit(long dailyLimit) {
        this.dailyLimit = dailyLimit;
    }

    public long getMonthlyLimit() {
        return monthlyLimit;
    }

    public void setMonthlyLimit(long monthlyLimit) {
        this.monthlyLimit = monthlyLimit;
    }

    public long getDailySpent() {
        return dailySpent;
    }

    public void setDailySpent(long dailySpent) {
        this.dailySpent = dailySpent;
    }

    public long getMonthlySpent() {
        return monthlySpent;
    }

    public void setMonthlySpent(long monthlySpent) {
        this.monthlySpent = monthlySpent;
    }

    public long getLastResetDay() {
        return lastResetDay;
    }

    public void setLastResetDay(long lastResetDay) {
        this.lastResetDay = lastResetDay;
    }

    public long getLastResetMonth() {
        return lastResetMonth;
    }

    public void setLastResetMonth(long lastResetMonth) {
        this.lastResetMonth = lastResetMonth;
    }

    public Instant getCooldownUntil() {
        return cooldownUntil;
    }

    public void setCooldownUntil(Instant cooldownUntil) {
        this.cooldownUntil = cooldownUntil;
    }

    public Instant getSelfExcludedUntil() {
        return selfExcludedUntil;
    }

    public void setSelfExcludedUntil(Instant selfExcludedUntil) {
        this.selfExcludedUntil = selfExcludedUntil;
    }

    public Set<String> getPlatformsUsed() {
        return Collections.unmodifiableSet(platformsUsed);
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getVersion() {
        return version;
    }
}
