package io.safestake.verifier.proof;

import com.fasterxml.jackson.databind.JsonNode;
import io.safestake.verifier.common.InvalidProofException;
import io.safestake.verifier.common.UpstreamServiceException;
import io.safestake.verifier.config.VerifierProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Forwards an age proof to the hosted verifier. Any 2xx answer counts as a valid proof; the
 * response body is not inspected.
 */
@Component
public class ProofVerifierClient {

    private static final Logger log = LoggerFactory.getLogger(ProofVerifierClient.class);

    private final RestClient restClient;
    private final String upstreamUrl;

    public ProofVerifierClient(RestClient proofVerifierRestClient, VerifierProperties properties) {
        this.restClient = proofVerifierRestClient;
        this.upstreamUrl = properties.resolveUpstreamUrl();
    }

    public void verify(JsonNode proof) {
        try {
            restClient.post()
                .uri(upstreamUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(proof)
                .retrieve()
                .toBodilessEntity();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.BAD_REQUEST.value() || status == HttpStatus.NOT_FOUND.value()) {
                log.info("Proof rejected by hosted verifier. status={}", status);
                throw new InvalidProofException("The age verification proof is invalid or could not be verified", e);
            }
            log.warn("Hosted verifier failed. status={} url={}", status, upstreamUrl);
            throw new UpstreamServiceException("Hosted verifier returned status " + status, e);
        } catch (RestClientException e) {
            log.warn("Hosted verifier unreachable. url={}", upstreamUrl, e);
            throw new UpstreamServiceException("Hosted verifier could not be reached", e);
        }
    }
}
