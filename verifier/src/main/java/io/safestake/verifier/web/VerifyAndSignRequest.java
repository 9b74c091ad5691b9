package io.safestake.verifier.web;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record VerifyAndSignRequest(
    @NotBlank @Size(max = 128) String accountAddress,
    @NotNull JsonNode proof
) {
}
