package io.safestake.verifier.config;

import io.safestake.attestation.AccountIdentifiers;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "safestake.verifier")
public class VerifierProperties {

    public static final String MAINNET_VERIFIER_URL = "https://web3id-verifier.mainnet.concordium.software/v0/verify";
    public static final String TESTNET_VERIFIER_URL = "http://localhost:7017/v0/verify";

    /**
     * Ed25519 seed, 64 hex characters. Left empty, a throwaway key is generated at startup.
     */
    private String signingKey;

    /**
     * Expected public key for {@link #signingKey}. Optional; checked at startup when set.
     */
    private String publicKey;

    /**
     * testnet or mainnet.
     */
    private String network = "testnet";

    /**
     * Overrides the hosted verifier chosen by {@link #network}.
     */
    private String upstreamUrl;

    private String networkPrefix = AccountIdentifiers.DEFAULT_NETWORK_PREFIX;

    private int connectTimeoutMillis = 10_000;

    private int readTimeoutMillis = 10_000;

    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000", "http://localhost:5173"));

    public String resolveUpstreamUrl() {
        if (upstreamUrl != null && !upstreamUrl.isBlank()) {
            return upstreamUrl;
        }
        return "mainnet".equalsIgnoreCase(network) ? MAINNET_VERIFIER_URL : TESTNET_VERIFIER_URL;
    }

    public String getSigningKey() {
        return signingKey;
    }

    public void setSigningKey(String signingKey) {
        this.signingKey = signingKey;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public void setPublicKey(String publicKey) {
        this.publicKey = publicKey;
    }

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public String getUpstreamUrl() {
        return upstreamUrl;
    }

    public void setUpstreamUrl(String upstreamUrl) {
        this.upstreamUrl = upstreamUrl;
    }

    public String getNetworkPrefix() {
        return networkPrefix;
    }

    public void setNetworkPrefix(String networkPrefix) {
        this.networkPrefix = networkPrefix;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public int getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public void setReadTimeoutMillis(int readTimeoutMillis) {
        this.readTimeoutMillis = readTimeoutMillis;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }
}
