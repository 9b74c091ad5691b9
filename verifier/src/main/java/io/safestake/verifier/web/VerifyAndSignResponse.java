package io.safestake.verifier.web;

public record VerifyAndSignResponse(
    String signature,
    String accountAddress,
    long timestamp
) {
}
