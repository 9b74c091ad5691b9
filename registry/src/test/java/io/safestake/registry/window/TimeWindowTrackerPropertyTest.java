package io.safestake.registry.window;

import static org.assertj.core.api.Assertions.assertThat;

import io.safestake.registry.account.ComplianceRecord;
import java.time.Instant;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.LongRange;

class TimeWindowTrackerPropertyTest {

    private final TimeWindowTracker tracker = new TimeWindowTracker(30);

    @Property(tries = 200)
    void storedBucketsNeverMoveBackwards(
        @ForAll @LongRange(min = 0, max = 4_000_000_000L) long storedAt,
        @ForAll @LongRange(min = 0, max = 4_000_000_000L) long queriedAt
    ) {
        ComplianceRecord record = record(Instant.ofEpochSecond(storedAt));
        long dayBefore = record.getLastResetDay();
        long monthBefore = record.getLastResetMonth();

        tracker.applyResets(record, Instant.ofEpochSecond(queriedAt));

        assertThat(record.getLastResetDay()).isGreaterThanOrEqualTo(dayBefore);
        assertThat(record.getLastResetMonth()).isGreaterThanOrEqualTo(monthBefore);
    }

    @Property(tries = 200)
    void spendIsEitherKeptOrZeroed(
        @ForAll @LongRange(min = 0, max = 4_000_000_000L) long storedAt,
        @ForAll @LongRange(min = 0, max = 4_000_000_000L) long queriedAt,
        @ForAll @LongRange(min = 0, max = 1_000_000L) long spent
    ) {
        ComplianceRecord record = record(Instant.ofEpochSecond(storedAt));
        record.setDailySpent(spent);
        record.setMonthlySpent(spent);

        WindowState state = tracker.evaluate(record, Instant.ofEpochSecond(queriedAt));

        assertThat(state.dailySpent()).isIn(0L, spent);
        assertThat(state.monthlySpent()).isIn(0L, spent);
        // a month reset implies the day moved too
        if (state.monthResetPending()) {
            assertThat(state.dayResetPending()).isTrue();
        }
    }

    private ComplianceRecord record(Instant at) {
        return ComplianceRecord.registered("3acct", at, tracker.dayBucket(at), tracker.monthBucket(at), 100L, 1_000L);
    }
}
