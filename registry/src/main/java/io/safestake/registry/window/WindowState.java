package io.safestake.registry.window;

/**
 * Spend accumulators as they stand at a given instant, with any pending day/month reset applied.
 */
public record WindowState(
    long dayBucket,
    long monthBucket,
    long dailySpent,
    long monthlySpent,
    boolean dayResetPending,
    boolean monthResetPending
) {

    public boolean resetPending() {
        return dayResetPending || monthResetPending;
    }
}
