package io.safestake.attestation;

import java.nio.charset.StandardCharsets;

/**
 * Builds the message an attestor signs for an account.
 *
 * <p>The message is the UTF-8 encoding of the account identifier with a single leading
 * network-version prefix removed. Signer and verifier must both go through this class,
 * otherwise every signature fails verification.
 */
public final class AccountIdentifiers {

    public static final String DEFAULT_NETWORK_PREFIX = "3";

    private AccountIdentifiers() {
    }

    public static String stripNetworkPrefix(String accountId, String networkPrefix) {
        if (accountId == null) {
            throw new IllegalArgumentException("accountId is required");
        }
        if (networkPrefix == null || networkPrefix.isEmpty()) {
            return accountId;
        }
        return accountId.startsWith(networkPrefix) ? accountId.substring(networkPrefix.length()) : accountId;
    }

    public static byte[] signingPayload(String accountId, String networkPrefix) {
        return stripNetworkPrefix(accountId, networkPrefix).getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] signingPayload(String accountId) {
        return signingPayload(accountId, DEFAULT_NETWORK_PREFIX);
    }
}
