package io.safestake.verifier.common;

import org.springframework.http.HttpStatus;

/**
 * The hosted verifier looked at the proof and refused it. Not retryable.
 */
public class InvalidProofException extends ApiException {

    public InvalidProofException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "INVALID_PROOF", message, cause);
    }
}
