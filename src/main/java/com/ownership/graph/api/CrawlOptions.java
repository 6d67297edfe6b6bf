package com.ownership.graph.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for ownership graph crawls.
 * Configures depth, per-round fan-out caps, aggregation limits, parallelism and the crawl deadline.
 */
public class CrawlOptions {

    private static final int DEFAULT_MAX_DEPTH = 2;
    private static final int DEFAULT_MAX_ALLOWED_DEPTH = 6;
    private static final int DEFAULT_MAX_PROPERTY_TASKS_PER_ROUND = 8;
    private static final int DEFAULT_MAX_NAME_TASKS_PER_ROUND = 5;
    private static final int DEFAULT_MAX_SHARED_ADDRESS_EXPANSIONS = 1;
    private static final int DEFAULT_REGISTRATION_BATCH_SIZE = 10;
    private static final int DEFAULT_MIN_ADDRESS_KEY_LENGTH = 11;
    private static final int DEFAULT_MIN_NAME_LENGTH = 3;
    private static final int DEFAULT_ENRICHMENT_BATCH_SIZE = 30;
    private static final int DEFAULT_CONNECTED_VIA_LIMIT = 3;
    private static final int DEFAULT_MAX_COMMON_ADDRESSES = 5;
    private static final int DEFAULT_CRAWL_PARALLELISM = 8;
    private static final Duration DEFAULT_CRAWL_TIMEOUT = Duration.ofSeconds(60);
    private static final int DEFAULT_MAX_LOOKUP_ATTEMPTS = 1;

    private final int defaultMaxDepth;
    private final int maxAllowedDepth;
    private final int maxPropertyTasksPerRound;
    private final int maxNameTasksPerRound;
    private final int maxSharedAddressExpansions;
    private final int registrationBatchSize;
    private final int minAddressKeyLength;
    private final int minNameLength;
    private final int enrichmentBatchSize;
    private final int connectedViaLimit;
    private final int maxCommonAddresses;
    private final int crawlParallelism;
    private final Duration crawlTimeout;
    private final int maxLookupAttempts;

    private CrawlOptions(Builder builder) {
        this.defaultMaxDepth = builder.defaultMaxDepth;
        this.maxAllowedDepth = builder.maxAllowedDepth;
        this.maxPropertyTasksPerRound = builder.maxPropertyTasksPerRound;
        this.maxNameTasksPerRound = builder.maxNameTasksPerRound;
        this.maxSharedAddressExpansions = builder.maxSharedAddressExpansions;
        this.registrationBatchSize = builder.registrationBatchSize;
        this.minAddressKeyLength = builder.minAddressKeyLength;
        this.minNameLength = builder.minNameLength;
        this.enrichmentBatchSize = builder.enrichmentBatchSize;
        this.connectedViaLimit = builder.connectedViaLimit;
        this.maxCommonAddresses = builder.maxCommonAddresses;
        this.crawlParallelism = builder.crawlParallelism;
        this.crawlTimeout = builder.crawlTimeout;
        this.maxLookupAttempts = builder.maxLookupAttempts;
    }

    public int getDefaultMaxDepth() {
        return defaultMaxDepth;
    }

    public int getMaxAllowedDepth() {
        return maxAllowedDepth;
    }

    public int getMaxPropertyTasksPerRound() {
        return maxPropertyTasksPerRound;
    }

    public int getMaxNameTasksPerRound() {
        return maxNameTasksPerRound;
    }

    public int getMaxSharedAddressExpansions() {
        return maxSharedAddressExpansions;
    }

    public int getRegistrationBatchSize() {
        return registrationBatchSize;
    }

    public int getMinAddressKeyLength() {
        return minAddressKeyLength;
    }

    public int getMinNameLength() {
        return minNameLength;
    }

    public int getEnrichmentBatchSize() {
        return enrichmentBatchSize;
    }

    public int getConnectedViaLimit() {
        return connectedViaLimit;
    }

    public int getMaxCommonAddresses() {
        return maxCommonAddresses;
    }

    public int getCrawlParallelism() {
        return crawlParallelism;
    }

    public Duration getCrawlTimeout() {
        return crawlTimeout;
    }

    public int getMaxLookupAttempts() {
        return maxLookupAttempts;
    }

    public static CrawlOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int defaultMaxDepth = DEFAULT_MAX_DEPTH;
        private int maxAllowedDepth = DEFAULT_MAX_ALLOWED_DEPTH;
        private int maxPropertyTasksPerRound = DEFAULT_MAX_PROPERTY_TASKS_PER_ROUND;
        private int maxNameTasksPerRound = DEFAULT_MAX_NAME_TASKS_PER_ROUND;
        private int maxSharedAddressExpansions = DEFAULT_MAX_SHARED_ADDRESS_EXPANSIONS;
        private int registrationBatchSize = DEFAULT_REGISTRATION_BATCH_SIZE;
        private int minAddressKeyLength = DEFAULT_MIN_ADDRESS_KEY_LENGTH;
        private int minNameLength = DEFAULT_MIN_NAME_LENGTH;
        private int enrichmentBatchSize = DEFAULT_ENRICHMENT_BATCH_SIZE;
        private int connectedViaLimit = DEFAULT_CONNECTED_VIA_LIMIT;
        private int maxCommonAddresses = DEFAULT_MAX_COMMON_ADDRESSES;
        private int crawlParallelism = DEFAULT_CRAWL_PARALLELISM;
        private Duration crawlTimeout = DEFAULT_CRAWL_TIMEOUT;
        private int maxLookupAttempts = DEFAULT_MAX_LOOKUP_ATTEMPTS;

        public Builder defaultMaxDepth(int defaultMaxDepth) {
            this.defaultMaxDepth = requirePositive(defaultMaxDepth, "defaultMaxDepth");
            return this;
        }

        public Builder maxAllowedDepth(int maxAllowedDepth) {
            this.maxAllowedDepth = requirePositive(maxAllowedDepth, "maxAllowedDepth");
            return this;
        }

        public Builder maxPropertyTasksPerRound(int maxPropertyTasksPerRound) {
            this.maxPropertyTasksPerRound = requirePositive(maxPropertyTasksPerRound, "maxPropertyTasksPerRound");
            return this;
        }

        public Builder maxNameTasksPerRound(int maxNameTasksPerRound) {
            this.maxNameTasksPerRound = requirePositive(maxNameTasksPerRound, "maxNameTasksPerRound");
            return this;
        }

        /**
         * Zero disables shared-address discovery.
         */
        public Builder maxSharedAddressExpansions(int maxSharedAddressExpansions) {
            if (maxSharedAddressExpansions < 0) {
                throw new IllegalArgumentException("maxSharedAddressExpansions must not be negative");
            }
            this.maxSharedAddressExpansions = maxSharedAddressExpansions;
            return this;
        }

        public Builder registrationBatchSize(int registrationBatchSize) {
            this.registrationBatchSize = requirePositive(registrationBatchSize, "registrationBatchSize");
            return this;
        }

        public Builder minAddressKeyLength(int minAddressKeyLength) {
            this.minAddressKeyLength = requirePositive(minAddressKeyLength, "minAddressKeyLength");
            return this;
        }

        public Builder minNameLength(int minNameLength) {
            this.minNameLength = requirePositive(minNameLength, "minNameLength");
            return this;
        }

        public Builder enrichmentBatchSize(int enrichmentBatchSize) {
            this.enrichmentBatchSize = requirePositive(enrichmentBatchSize, "enrichmentBatchSize");
            return this;
        }

        public Builder connectedViaLimit(int connectedViaLimit) {
            this.connectedViaLimit = requirePositive(connectedViaLimit, "connectedViaLimit");
            return this;
        }

        public Builder maxCommonAddresses(int maxCommonAddresses) {
            this.maxCommonAddresses = requirePositive(maxCommonAddresses, "maxCommonAddresses");
            return this;
        }

        public Builder crawlParallelism(int crawlParallelism) {
            this.crawlParallelism = requirePositive(crawlParallelism, "crawlParallelism");
            return this;
        }

        public Builder crawlTimeout(Duration crawlTimeout) {
            Objects.requireNonNull(crawlTimeout, "crawlTimeout is required");
            if (crawlTimeout.isNegative() || crawlTimeout.isZero()) {
                throw new IllegalArgumentException("crawlTimeout must be positive");
            }
            this.crawlTimeout = crawlTimeout;
            return this;
        }

        public Builder maxLookupAttempts(int maxLookupAttempts) {
            this.maxLookupAttempts = requirePositive(maxLookupAttempts, "maxLookupAttempts");
            return this;
        }

        public CrawlOptions build() {
            if (defaultMaxDepth > maxAllowedDepth) {
                throw new IllegalArgumentException("defaultMaxDepth must be <= maxAllowedDepth");
            }
            return new CrawlOptions(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "CrawlOptions{" +
                "defaultMaxDepth=" + defaultMaxDepth +
                ", maxAllowedDepth=" + maxAllowedDepth +
                ", maxPropertyTasksPerRound=" + maxPropertyTasksPerRound +
                ", maxNameTasksPerRound=" + maxNameTasksPerRound +
                ", maxSharedAddressExpansions=" + maxSharedAddressExpansions +
                ", registrationBatchSize=" + registrationBatchSize +
                ", enrichmentBatchSize=" + enrichmentBatchSize +
                ", crawlParallelism=" + crawlParallelism +
                ", crawlTimeout=" + crawlTimeout +
                ", maxLookupAttempts=" + maxLookupAttempts +
                '}';
    }
}
