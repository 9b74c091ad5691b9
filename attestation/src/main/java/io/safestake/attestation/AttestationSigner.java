package io.safestake.attestation;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;

/**
 * Signs account identifiers on behalf of the attestor once age verification succeeded.
 */
public class AttestationSigner {

    private final PrivateKey privateKey;
    private final byte[] rawPublicKey;
    private final String networkPrefix;

    public AttestationSigner(byte[] seed, String networkPrefix) throws GeneralSecurityException {
        this.privateKey = Ed25519Keys.privateKey(seed);
        this.rawPublicKey = Ed25519Keys.derivePublicKey(seed);
        this.networkPrefix = networkPrefix;
    }

    public static AttestationSigner fromHex(String seedHex, String networkPrefix) throws GeneralSecurityException {
        return new AttestationSigner(Ed25519Keys.parseHex(seedHex, Ed25519Keys.KEY_LENGTH, "signing key"), networkPrefix);
    }

    public byte[] sign(String accountId) {
        return signMessage(AccountIdentifiers.signingPayload(accountId, networkPrefix));
    }

    public String signHex(String accountId) {
        return Ed25519Keys.toHex(sign(accountId));
    }

    public byte[] signMessage(byte[] message) {
        try {
            Signature signer = Signature.getInstance("Ed25519");
            signer.initSign(privateKey);
            signer.update(message);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 signing failed", e);
        }
    }

    public byte[] publicKey() {
        return rawPublicKey.clone();
    }

    public String publicKeyHex() {
        return Ed25519Keys.toHex(rawPublicKey);
    }
}
