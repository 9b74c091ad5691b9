package io.safestake.registry.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterUserRequest(
    @NotBlank @Size(max = 128) String accountId,
    @NotBlank @Pattern(regexp = "^[0-9a-fA-F]{128}$", message = "must be 128 hex characters") String signature
) {
}
