package io.safestake.verifier.config;

import io.safestake.attestation.AttestationSigner;
import io.safestake.attestation.Ed25519Keys;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SigningKeyConfig {

    private static final Logger log = LoggerFactory.getLogger(SigningKeyConfig.class);

    @Bean
    public AttestationSigner attestationSigner(VerifierProperties properties) throws GeneralSecurityException {
        String signingKey = properties.getSigningKey();
        AttestationSigner signer;
        if (signingKey == null || signingKey.isBlank()) {
            byte[] seed = new byte[Ed25519Keys.KEY_LENGTH];
            new SecureRandom().nextBytes(seed);
            signer = new AttestationSigner(seed, properties.getNetworkPrefix());
            log.warn("safestake.verifier.signing-key is not set; generated a temporary key for development only. publicKey={}",
                signer.publicKeyHex());
            return signer;
        }

        signer = AttestationSigner.fromHex(signingKey.trim(), properties.getNetworkPrefix());
        String expected = properties.getPublicKey();
        if (expected != null && !expected.isBlank() && !expected.trim().equalsIgnoreCase(signer.publicKeyHex())) {
            throw new IllegalStateException("safestake.verifier.public-key does not match safestake.verifier.signing-key");
        }
        log.info("Attestation signing key loaded. network={} publicKey={}", properties.getNetwork(), signer.publicKeyHex());
        return signer;
    }
}
