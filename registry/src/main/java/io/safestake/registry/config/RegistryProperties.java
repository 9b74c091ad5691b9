package io.safestake.registry.config;

import io.safestake.attestation.AccountIdentifiers;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "safestake")
public class RegistryProperties {

    private String attestorPublicKey;
    private String networkPrefix = AccountIdentifiers.DEFAULT_NETWORK_PREFIX;
    private final Registry registry = new Registry();
    private final Outbox outbox = new Outbox();

    public String getAttestorPublicKey() {
        return attestorPublicKey;
    }

    public void setAttestorPublicKey(String attestorPublicKey) {
        this.attestorPublicKey = attestorPublicKey;
    }

    public String getNetworkPrefix() {
        return networkPrefix;
    }

    public void setNetworkPrefix(String networkPrefix) {
        this.networkPrefix = networkPrefix;
    }

    public Registry getRegistry() {
        return registry;
    }

    public Outbox getOutbox() {
        return outbox;
    }

    public static class Registry {
        private String store = "jpa";
        private long lockTimeoutMs = 5000L;
        private int lockStripes = 256;
        private int monthLengthDays = 30;
        private long defaultDailyLimit = 0L;
        private long defaultMonthlyLimit = 0L;
        private int maxSelfExclusionDays = 3650;
        private int maxCooldownHours = 720;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public long getLockTimeoutMs() {
            return lockTimeoutMs;
        }

        public void setLockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
        }

        public int getLockStripes() {
            return lockStripes;
        }

        public void setLockStripes(int lockStripes) {
            this.lockStripes = lockStripes;
        }

        public int getMonthLengthDays() {
            return monthLengthDays;
        }

        public void setMonthLengthDays(int monthLengthDays) {
            this.monthLengthDays = monthLengthDays;
        }

        public long getDefaultDailyLimit() {
            return defaultDailyLimit;
        }

        public void setDefaultDailyLimit(long defaultDailyLimit) {
            this.defaultDailyLimit = defaultDailyLimit;
        }

        public long getDefaultMonthlyLimit() {
            return defaultMonthlyLimit;
        }

        public void setDefaultMonthlyLimit(long defaultMonthlyLimit) {
            this.defaultMonthlyLimit = defaultMonthlyLimit;
        }

        public int getMaxSelfExclusionDays() {
            return maxSelfExclusionDays;
        }

        public void setMaxSelfExclusionDays(int maxSelfExclusionDays) {
            this.maxSelfExclusionDays = maxSelfExclusionDays;
        }

        public int getMaxCooldownHours() {
            return maxCooldownHours;
        }

        public void setMaxCooldownHours(int maxCooldownHours) {
            this.maxCooldownHours = maxCooldownHours;
        }
    }

    public static class Outbox {
        private boolean kafkaEnabled = true;
        private String topic = "safestake.compliance.events";
        private int maxAttempts = 30;
        private long pollIntervalMs = 1000L;
        private int claimBatchSize = 100;
        private int maxRoundsPerPoll = 10;
        private int backoffSeconds = 60;

        public boolean isKafkaEnabled() {
            return kafkaEnabled;
        }

        public void setKafkaEnabled(boolean kafkaEnabled) {
            this.kafkaEnabled = kafkaEnabled;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getClaimBatchSize() {
            return claimBatchSize;
        }

        public void setClaimBatchSize(int claimBatchSize) {
            this.claimBatchSize = claimBatchSize;
        }

        public int getMaxRoundsPerPoll() {
            return maxRoundsPerPoll;
        }

        public void setMaxRoundsPerPoll(int maxRoundsPerPoll) {
            this.maxRoundsPerPoll = maxRoundsPerPoll;
        }

        public int getBackoffSeconds() {
            return backoffSeconds;
        }

        public void setBackoffSeconds(int backoffSeconds) {
            this.backoffSeconds = backoffSeconds;
        }
    }
}
