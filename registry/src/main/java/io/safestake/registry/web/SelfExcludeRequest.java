package io.safestake.registry.web;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record SelfExcludeRequest(
    @NotNull @Positive Integer durationDays
) {
}
