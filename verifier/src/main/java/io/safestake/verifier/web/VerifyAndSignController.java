package io.safestake.verifier.web;

import io.safestake.attestation.AttestationSigner;
import io.safestake.verifier.common.ApiException;
import io.safestake.verifier.config.VerifierProperties;
import io.safestake.verifier.proof.ProofVerifierClient;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class VerifyAndSignController {

    private static final Logger log = LoggerFactory.getLogger(VerifyAndSignController.class);

    private final ProofVerifierClient proofVerifierClient;
    private final AttestationSigner attestationSigner;
    private final VerifierProperties properties;
    private final Clock clock;

    public VerifyAndSignController(
        ProofVerifierClient proofVerifierClient,
        AttestationSigner attestationSigner,
        VerifierProperties properties,
        Clock clock
    ) {
        this.proofVerifierClient = proofVerifierClient;
        this.attestationSigner = attestationSigner;
        this.properties = properties;
        this.clock = clock;
    }

    @PostMapping("/api/verify-and-sign")
    public VerifyAndSignResponse verifyAndSign(@Valid @RequestBody VerifyAndSignRequest request) {
        if (!request.proof().isObject()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "proof must be a JSON object");
        }
        long startedAt = clock.millis();

        proofVerifierClient.verify(request.proof());
        String signature = attestationSigner.signHex(request.accountAddress());

        log.info("Age attestation issued. accountAddress={} elapsedMs={}", request.accountAddress(), clock.millis() - startedAt);
        return new VerifyAndSignResponse(signature, request.accountAddress(), clock.millis());
    }

    @GetMapping("/api/public-key")
    public Map<String, Object> publicKey() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("publicKey", attestationSigner.publicKeyHex());
        body.put("network", properties.getNetwork());
        body.put("note", "Configure this key as the registry's attestor public key");
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "safestake-verifier");
        body.put("network", properties.getNetwork());
        body.put("timestamp", clock.millis());
        return body;
    }
}
