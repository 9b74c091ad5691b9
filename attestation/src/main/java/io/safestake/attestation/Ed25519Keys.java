package io.safestake.attestation;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.NamedParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Conversions between raw 32-byte Ed25519 keys (as exchanged in hex with attestors) and JDK keys.
 */
public final class Ed25519Keys {

    public static final int KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    private static final String ALGORITHM = "Ed25519";
    // SubjectPublicKeyInfo header for id-Ed25519 (1.3.101.112), followed by the 32 raw bytes.
    private static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");
    // PrivateKeyInfo header wrapping a 32-byte seed.
    private static final byte[] PKCS8_PREFIX = HexFormat.of().parseHex("302e020100300506032b657004220420");

    private Ed25519Keys() {
    }

    public static PublicKey publicKey(byte[] rawKey) throws GeneralSecurityException {
        requireLength(rawKey, "public key");
        return keyFactory().generatePublic(new X509EncodedKeySpec(concat(X509_PREFIX, rawKey)));
    }

    public static PrivateKey privateKey(byte[] seed) throws GeneralSecurityException {
        requireLength(seed, "signing key");
        return keyFactory().generatePrivate(new PKCS8EncodedKeySpec(concat(PKCS8_PREFIX, seed)));
    }

    public static byte[] rawPublicKey(PublicKey publicKey) {
        byte[] encoded = publicKey.getEncoded();
        return Arrays.copyOfRange(encoded, encoded.length - KEY_LENGTH, encoded.length);
    }

    public static byte[] rawPrivateKey(PrivateKey privateKey) {
        byte[] encoded = privateKey.getEncoded();
        return Arrays.copyOfRange(encoded, encoded.length - KEY_LENGTH, encoded.length);
    }

    /**
     * Derives the raw public key for a raw seed. The JDK has no public API for this, so the key pair
     * generator is fed the seed as its only source of randomness.
     */
    public static byte[] derivePublicKey(byte[] seed) throws GeneralSecurityException {
        requireLength(seed, "signing key");
        KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM);
        generator.initialize(NamedParameterSpec.ED25519, new FixedSeedRandom(seed));
        return rawPublicKey(generator.generateKeyPair().getPublic());
    }

    public static KeyPair generateKeyPair() throws GeneralSecurityException {
        return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
    }

    public static byte[] parseHex(String hex, int expectedLength, String name) {
        if (hex == null || hex.length() != expectedLength * 2) {
            throw new IllegalArgumentException(name + " must be " + (expectedLength * 2) + " hex characters");
        }
        try {
            return HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(name + " is not valid hex", e);
        }
    }

    public static String toHex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    private static KeyFactory keyFactory() throws GeneralSecurityException {
        return KeyFactory.getInstance(ALGORITHM);
    }

    private static void requireLength(byte[] key, String name) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException(name + " must be " + KEY_LENGTH + " bytes");
        }
    }

    private static final class FixedSeedRandom extends SecureRandom {

        private final byte[] seed;

        private FixedSeedRandom(byte[] seed) {
            this.seed = seed.clone();
        }

        @Override
        public void nextBytes(byte[] bytes) {
            if (bytes.length != seed.length) {
                throw new IllegalStateException("Unexpected Ed25519 seed request of " + bytes.length + " bytes");
            }
            System.arraycopy(seed, 0, bytes, 0, seed.length);
        }
    }

    private static byte[] concat(byte[] prefix, byte[] body) {
        byte[] out = Arrays.copyOf(prefix, prefix.length + body.length);
        System.arraycopy(body, 0, out, prefix.length, body.length);
        return out;
    }
}
