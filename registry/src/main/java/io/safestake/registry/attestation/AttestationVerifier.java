package io.safestake.registry.attestation;

import io.safestake.attestation.AccountIdentifiers;
import io.safestake.attestation.Ed25519Keys;
import io.safestake.attestation.Ed25519SignatureVerifier;
import io.safestake.registry.config.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks age-verification attestations against the registry-wide attestor key fixed at startup.
 */
@Component
public class AttestationVerifier {

    private static final Logger log = LoggerFactory.getLogger(AttestationVerifier.class);

    private final byte[] attestorPublicKey;
    private final String networkPrefix;

    public AttestationVerifier(RegistryProperties properties) {
        String keyHex = properties.getAttestorPublicKey();
        if (keyHex == null || keyHex.isBlank()) {
            throw new IllegalStateException("safestake.attestor-public-key is not configured");
        }
        this.attestorPublicKey = Ed25519Keys.parseHex(keyHex.trim(), Ed25519Keys.KEY_LENGTH, "safestake.attestor-public-key");
        this.networkPrefix = properties.getNetworkPrefix();
        log.info("Attestor public key loaded. publicKey={} networkPrefix={}", keyHex.trim(), networkPrefix);
    }

    public boolean isValid(String accountId, byte[] signature) {
        return Ed25519SignatureVerifier.verify(
            AccountIdentifiers.signingPayload(accountId, networkPrefix),
            signature,
            attestorPublicKey
        );
    }
}
