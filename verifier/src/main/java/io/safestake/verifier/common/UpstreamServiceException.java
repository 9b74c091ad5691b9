package io.safestake.verifier.common;

import org.springframework.http.HttpStatus;

/**
 * The hosted verifier could not be reached or failed on its side. The caller may retry.
 */
public class UpstreamServiceException extends ApiException {

    public UpstreamServiceException(String message) {
        super(HttpStatus.BAD_GATEWAY, "UPSTREAM_UNAVAILABLE", message);
    }

    public UpstreamServiceException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "UPSTREAM_UNAVAILABLE", message, cause);
    }
}
