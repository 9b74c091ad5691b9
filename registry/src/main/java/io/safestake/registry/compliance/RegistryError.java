package io.safestake.registry.compliance;

import io.safestake.registry.eligibility.EligibilityStatus;
import org.springframework.http.HttpStatus;

/**
 * Typed failures of registry operations. Policy errors are expected outcomes callers branch on;
 * consistency errors mean the operation can never succeed twice.
 */
public enum RegistryError {

    INVALID_REQUEST(Category.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_SIGNATURE(Category.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_LIMITS(Category.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_AMOUNT(Category.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_DURATION(Category.VALIDATION, HttpStatus.BAD_REQUEST),

    NOT_REGISTERED(Category.POLICY, HttpStatus.NOT_FOUND),
    AGE_NOT_VERIFIED(Category.POLICY, HttpStatus.FORBIDDEN),
    SELF_EXCLUDED(Category.POLICY, HttpStatus.FORBIDDEN),
    ON_COOLDOWN(Category.POLICY, HttpStatus.FORBIDDEN),
    DAILY_LIMIT_REACHED(Category.POLICY, HttpStatus.UNPROCESSABLE_ENTITY),
    MONTHLY_LIMIT_REACHED(Category.POLICY, HttpStatus.UNPROCESSABLE_ENTITY),

    ALREADY_REGISTERED(Category.CONSISTENCY, HttpStatus.CONFLICT),
    ALREADY_EXCLUDED(Category.CONSISTENCY, HttpStatus.CONFLICT),
    COOLDOWN_ACTIVE(Category.CONSISTENCY, HttpStatus.CONFLICT),
    ACCOUNT_BUSY(Category.CONSISTENCY, HttpStatus.CONFLICT);

    public enum Category {
        VALIDATION,
        POLICY,
        CONSISTENCY
    }

    private final Category category;
    private final HttpStatus status;

    RegistryError(Category category, HttpStatus status) {
        this.category = category;
        this.status = status;
    }

    public Category getCategory() {
        return category;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public static RegistryError fromEligibility(EligibilityStatus status) {
        return switch (status) {
            case NOT_REGISTERED -> NOT_REGISTERED;
            case AGE_NOT_VERIFIED -> AGE_NOT_VERIFIED;
            case SELF_EXCLUDED -> SELF_EXCLUDED;
            case ON_COOLDOWN -> ON_COOLDOWN;
            case DAILY_LIMIT_REACHED -> DAILY_LIMIT_REACHED;
            case MONTHLY_LIMIT_REACHED -> MONTHLY_LIMIT_REACHED;
            case ELIGIBLE -> throw new IllegalArgumentException("ELIGIBLE is not an error");
        };
    }
}
