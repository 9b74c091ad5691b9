package io.safestake.attestation;

import java.security.GeneralSecurityException;
import java.security.ProviderException;
import java.security.PublicKey;
import java.security.Signature;

/**
 * Stateless Ed25519 verification. Any malformed input verifies as {@code false}; nothing is thrown.
 */
public final class Ed25519SignatureVerifier {

    private Ed25519SignatureVerifier() {
    }

    public static boolean verify(byte[] message, byte[] signature, byte[] rawPublicKey) {
        if (message == null
            || signature == null || signature.length != Ed25519Keys.SIGNATURE_LENGTH
            || rawPublicKey == null || rawPublicKey.length != Ed25519Keys.KEY_LENGTH) {
            return false;
        }
        try {
            PublicKey publicKey = Ed25519Keys.publicKey(rawPublicKey);
            return verify(message, signature, publicKey);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            // not a point on the curve
            return false;
        }
    }

    public static boolean verify(byte[] message, byte[] signature, PublicKey publicKey) {
        if (message == null || signature == null || signature.length != Ed25519Keys.SIGNATURE_LENGTH) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(publicKey);
            verifier.update(message);
            return verifier.verify(signature);
        } catch (GeneralSecurityException | ProviderException e) {
            return false;
        }
    }
}
