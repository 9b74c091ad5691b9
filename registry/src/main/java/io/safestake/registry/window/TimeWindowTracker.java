package io.safestake.registry.window;

import io.safestake.registry.account.ComplianceRecord;
import io.safestake.registry.config.RegistryProperties;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Derives day and month buckets from a timestamp and resets spend lazily.
 *
 * <p>A month is a fixed window of {@code monthLengthDays} days counted from the epoch, not a
 * calendar month. Only the stored bucket is compared with the current one, so any number of
 * skipped buckets collapses into a single reset. A bucket older than the stored one (clock moved
 * backwards) never triggers a reset, so stored buckets only move forward.
 */
@Component
public class TimeWindowTracker {

    public static final long SECONDS_PER_DAY = 86_400L;

    private final long monthLengthSeconds;

    @Autowired
    public TimeWindowTracker(RegistryProperties properties) {
        this(properties.getRegistry().getMonthLengthDays());
    }

    public TimeWindowTracker(int monthLengthDays) {
        if (monthLengthDays <= 0) {
            throw new IllegalArgumentException("monthLengthDays must be positive");
        }
        this.monthLengthSeconds = monthLengthDays * SECONDS_PER_DAY;
    }

    public long dayBucket(Instant now) {
        return Math.floorDiv(now.getEpochSecond(), SECONDS_PER_DAY);
    }

    public long monthBucket(Instant now) {
        return Math.floorDiv(now.getEpochSecond(), monthLengthSeconds);
    }

    public WindowState evaluate(ComplianceRecord record, Instant now) {
        long day = dayBucket(now);
        long month = monthBucket(now);
        boolean dayReset = day > record.getLastResetDay();
        boolean monthReset = month > record.getLastResetMonth();
        return new WindowState(
            dayReset ? day : record.getLastResetDay(),
            monthReset ? month : record.getLastResetMonth(),
            dayReset ? 0L : record.getDailySpent(),
            monthReset ? 0L : record.getMonthlySpent(),
            dayReset,
            monthReset
        );
    }

    /**
     * Writes the effective window state into {@code record}. Must run inside the same atomic
     * operation as the mutation that triggered it.
     *
     * @return true if the record changed
     */
    public boolean applyResets(ComplianceRecord record, Instant now) {
        WindowState state = evaluate(record, now);
        if (!state.resetPending()) {
            return false;
        }
        record.setLastResetDay(state.dayBucket());
        record.setLastResetMonth(state.monthBucket());
        record.setDailySpent(state.dailySpent());
        record.setMonthlySpent(state.monthlySpent());
        return true;
    }
}
