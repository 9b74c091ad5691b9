package io.safestake.registry.eligibility;

/**
 * Outcome of an eligibility check. Declaration order is the evaluation precedence.
 */
public enum EligibilityStatus {
    NOT_REGISTERED("User is not registered"),
    AGE_NOT_VERIFIED("User has not completed age verification"),
    SELF_EXCLUDED("User is currently self-excluded"),
    ON_COOLDOWN("User is in cooldown period"),
    DAILY_LIMIT_REACHED("Daily spending limit would be exceeded"),
    MONTHLY_LIMIT_REACHED("Monthly spending limit would be exceeded"),
    ELIGIBLE("User is eligible to place this bet");

    private final String message;

    EligibilityStatus(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public boolean isEligible() {
        return this == ELIGIBLE;
    }
}
