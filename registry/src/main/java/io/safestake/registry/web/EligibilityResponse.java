package io.safestake.registry.web;

import io.safestake.registry.eligibility.EligibilityDecision;
import io.safestake.registry.eligibility.EligibilityStatus;

public record EligibilityResponse(
    String accountId,
    EligibilityStatus status,
    boolean eligible,
    long remainingDailyLimit,
    long remainingMonthlyLimit,
    String message
) {

    static EligibilityResponse of(String accountId, EligibilityDecision decision) {
        return new EligibilityResponse(
            accountId,
            decision.status(),
            decision.eligible(),
            decision.remainingDailyLimit(),
            decision.remainingMonthlyLimit(),
            decision.status().getMessage()
        );
    }
}
