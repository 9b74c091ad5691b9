package io.safestake.registry.account;

public class DuplicateAccountException extends RuntimeException {

    public DuplicateAccountException(String accountId, Throwable cause) {
        super("Account already registered: " + accountId, cause);
    }
}
