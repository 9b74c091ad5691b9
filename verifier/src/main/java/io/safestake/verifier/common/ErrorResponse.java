package io.safestake.verifier.common;

public record ErrorResponse(
    boolean success,
    String error,
    String message,
    int status,
    long timestamp
) {

    public static ErrorResponse of(String error, String message, int status) {
        return new ErrorResponse(false, error, message, status, System.currentTimeMillis());
    }
}
