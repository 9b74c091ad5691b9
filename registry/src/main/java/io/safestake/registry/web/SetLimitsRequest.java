package io.safestake.registry.web;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record SetLimitsRequest(
    @NotNull @PositiveOrZero Long dailyLimit,
    @NotNull @PositiveOrZero Long monthlyLimit
) {
}
