package io.safestake.registry.eligibility;

public record EligibilityDecision(
    EligibilityStatus status,
    long remainingDailyLimit,
    long remainingMonthlyLimit
) {

    public static EligibilityDecision notRegistered() {
        return new EligibilityDecision(EligibilityStatus.NOT_REGISTERED, 0L, 0L);
    }

    public boolean eligible() {
        return status.isEligible();
    }
}
