package io.safestake.registry.compliance;

import io.safestake.registry.common.ApiException;

public class RegistryException extends ApiException {

    private final RegistryError error;

    public RegistryException(RegistryError error, String message) {
        super(error.getStatus(), message);
        this.error = error;
    }

    public RegistryError getError() {
        return error;
    }
}
