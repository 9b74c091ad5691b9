package io.safestake.registry.common;

import java.time.Instant;

public record ErrorResponse(
    boolean success,
    String error,
    String message,
    int status,
    Instant timestamp
) {

    public static ErrorResponse of(String error, String message, int status) {
        return new ErrorResponse(false, error, message, status, Instant.now());
    }
}
