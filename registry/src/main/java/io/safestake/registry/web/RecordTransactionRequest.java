package io.safestake.registry.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record RecordTransactionRequest(
    @NotNull @PositiveOrZero Long amount,
    @NotBlank @Size(max = 128) String platformId
) {
}
