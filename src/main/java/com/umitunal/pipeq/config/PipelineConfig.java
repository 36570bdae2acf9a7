package com.umitunal.pipeq.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Settings for the three pipeline stages and the retention of everything they write.
 *
 * Values come from the builder, or from {@link #load()} which reads {@code pipeq.properties}
 * from the classpath and lets environment variables override individual keys
 * ({@code pipeq.delivery.max-attempts} becomes {@code PIPEQ_DELIVERY_MAX_ATTEMPTS}).
 */
public class PipelineConfig {
    public static final String RESOURCE = "pipeq.properties";

    /**
     * How the dedup ledger lays out its records.
     */
    public enum LedgerStrategy {
        /** One key per subject. */
        KEYED,
        /** A single document holding every subject; needs a single writer. */
        CONSOLIDATED
    }

    /**
     * Codec for the consolidated ledger document.
     */
    public enum LedgerCodec {
        JSON,
        KRYO
    }

    private final StorageConfig storage;
    private final String listingUrl;
    private final String webhookUrl;
    private final String enrichmentEndpoint;
    private final String enrichmentModel;
    private final int enrichmentBatchSize;
    private final int deliveryBatchSize;
    private final int enrichmentMaxAttempts;
    private final int deliveryMaxAttempts;
    private final Duration queueRetention;
    private final Duration leaseTtl;
    private final Duration deadLetterRetention;
    private final Duration seenRetention;
    private final Duration enrichmentCacheRetention;
    private final Duration deliveryPacing;
    private final Duration discoveryInterval;
    private final Duration enrichmentInterval;
    private final Duration deliveryInterval;
    private final LedgerStrategy ledgerStrategy;
    private final LedgerCodec ledgerCodec;

    private PipelineConfig(Builder builder) {
        this.storage = builder.storage;
        this.listingUrl = builder.listingUrl;
        this.webhookUrl = builder.webhookUrl;
        this.enrichmentEndpoint = builder.enrichmentEndpoint;
        this.enrichmentModel = builder.enrichmentModel;
        this.enrichmentBatchSize = builder.enrichmentBatchSize;
        this.deliveryBatchSize = builder.deliveryBatchSize;
        this.enrichmentMaxAttempts = builder.enrichmentMaxAttempts;
        this.deliveryMaxAttempts = builder.deliveryMaxAttempts;
        this.queueRetention = builder.queueRetention;
        this.leaseTtl = builder.leaseTtl;
        this.deadLetterRetention = builder.deadLetterRetention;
        this.seenRetention = builder.seenRetention;
        this.enrichmentCacheRetention = builder.enrichmentCacheRetention;
        this.deliveryPacing = builder.deliveryPacing;
        this.discoveryInterval = builder.discoveryInterval;
        this.enrichmentInterval = builder.enrichmentInterval;
        this.deliveryInterval = builder.deliveryInterval;
        this.ledgerStrategy = builder.ledgerStrategy;
        this.ledgerCodec = builder.ledgerCodec;
    }

    public StorageConfig getStorage() { return storage; }
    public String getListingUrl() { return listingUrl; }
    public String getWebhookUrl() { return webhookUrl; }
    public String getEnrichmentEndpoint() { return enrichmentEndpoint; }
    public String getEnrichmentModel() { return enrichmentModel; }
    public int getEnrichmentBatchSize() { return enrichmentBatchSize; }
    public int getDeliveryBatchSize() { return deliveryBatchSize; }
    public int getEnrichmentMaxAttempts() { return enrichmentMaxAttempts; }
    public int getDeliveryMaxAttempts() { return deliveryMaxAttempts; }
    public Duration getQueueRetention() { return queueRetention; }
    public Duration getLeaseTtl() { return leaseTtl; }
    public Duration getDeadLetterRetention() { return deadLetterRetention; }
    public Duration getSeenRetention() { return seenRetention; }
    public Duration getEnrichmentCacheRetention() { return enrichmentCacheRetention; }
    public Duration getDeliveryPacing() { return deliveryPacing; }
    public Duration getDiscoveryInterval() { return discoveryInterval; }
    public Duration getEnrichmentInterval() { return enrichmentInterval; }
    public Duration getDeliveryInterval() { return deliveryInterval; }
    public LedgerStrategy getLedgerStrategy() { return ledgerStrategy; }
    public LedgerCodec getLedgerCodec() { return ledgerCodec; }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Load from the classpath resource, overridden by process environment variables.
     */
    public static PipelineConfig load() {
        return load(RESOURCE, System::getenv);
    }

    /**
     * Load from a classpath resource with an explicit environment lookup.
     * A missing resource is not an error; defaults apply.
     */
    public static PipelineConfig load(String resource, Function<String, String> environment) {
        Properties properties = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new PipelineConfigurationException("Cannot read " + resource, e);
        }
        return fromProperties(properties, environment);
    }

    public static PipelineConfig fromProperties(Properties properties, Function<String, String> environment) {
        Settings settings = new Settings(properties, environment);
        Builder builder = newBuilder();

        StorageConfig.Backend backend = settings.enumValue("pipeq.storage.backend", StorageConfig.Backend.class,
                StorageConfig.Backend.ROCKSDB);
        if (backend == StorageConfig.Backend.MEMORY) {
            builder.withStorage(StorageConfig.inMemory());
        } else {
            builder.withStorage(StorageConfig.newBuilder(settings.string("pipeq.storage.data-dir", "data/pipeq"))
                    .withDurableWrites(settings.bool("pipeq.storage.durable-writes", true))
                    .build());
        }

        return builder
                .withListingUrl(settings.string("pipeq.discovery.listing-url", null))
                .withDiscoveryInterval(settings.duration("pipeq.discovery.interval", builder.discoveryInterval))
                .withEnrichmentEndpoint(settings.string("pipeq.enrichment.endpoint", null))
                .withEnrichmentModel(settings.string("pipeq.enrichment.model", null))
                .withEnrichmentBatchSize(settings.positiveInt("pipeq.enrichment.batch-size", builder.enrichmentBatchSize))
                .withEnrichmentMaxAttempts(settings.positiveInt("pipeq.enrichment.max-attempts", builder.enrichmentMaxAttempts))
                .withEnrichmentInterval(settings.duration("pipeq.enrichment.interval", builder.enrichmentInterval))
                .withEnrichmentCacheRetention(settings.duration("pipeq.enrichment.cache-retention", builder.enrichmentCacheRetention))
                .withWebhookUrl(settings.string("pipeq.delivery.webhook-url", null))
                .withDeliveryBatchSize(settings.positiveInt("pipeq.delivery.batch-size", builder.deliveryBatchSize))
                .withDeliveryMaxAttempts(settings.positiveInt("pipeq.delivery.max-attempts", builder.deliveryMaxAttempts))
                .withDeliveryInterval(settings.duration("pipeq.delivery.interval", builder.deliveryInterval))
                .withDeliveryPacing(settings.duration("pipeq.delivery.pacing", builder.deliveryPacing))
                .withQueueRetention(settings.duration("pipeq.queue.retention", builder.queueRetention))
                .withLeaseTtl(settings.duration("pipeq.lease.ttl", builder.leaseTtl))
                .withDeadLetterRetention(settings.duration("pipeq.dlq.retention", builder.deadLetterRetention))
                .withSeenRetention(settings.duration("pipeq.seen.retention", builder.seenRetention))
                .withLedgerStrategy(settings.enumValue("pipeq.seen.strategy", LedgerStrategy.class, builder.ledgerStrategy))
                .withLedgerCodec(settings.enumValue("pipeq.seen.codec", LedgerCodec.class, builder.ledgerCodec))
                .build();
    }

    /**
     * Environment variable name for a property key.
     */
    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    public static class Builder {
        private StorageConfig storage = StorageConfig.inMemory();
        private String listingUrl;
        private String webhookUrl;
        private String enrichmentEndpoint;
        private String enrichmentModel;
        private int enrichmentBatchSize = 5;
        private int deliveryBatchSize = 10;
        private int enrichmentMaxAttempts = 3;
        private int deliveryMaxAttempts = 5;
        private Duration queueRetention = Duration.ofDays(7);
        private Duration leaseTtl = Duration.ofMinutes(15);
        private Duration deadLetterRetention = Duration.ofDays(30);
        private Duration seenRetention = Duration.ofDays(90);
        private Duration enrichmentCacheRetention = Duration.ofDays(14);
        private Duration deliveryPacing = Duration.ofMillis(200);
        private Duration discoveryInterval = Duration.ofHours(1);
        private Duration enrichmentInterval = Duration.ofMinutes(15);
        private Duration deliveryInterval = Duration.ofMinutes(5);
        private LedgerStrategy ledgerStrategy = LedgerStrategy.KEYED;
        private LedgerCodec ledgerCodec = LedgerCodec.JSON;

        private Builder() {
        }

        public Builder withStorage(StorageConfig storage) {
            this.storage = storage;
            return this;
        }

        public Builder withListingUrl(String url) {
            this.listingUrl = url;
            return this;
        }

        public Builder withWebhookUrl(String url) {
            this.webhookUrl = url;
            return this;
        }

        public Builder withEnrichmentEndpoint(String url) {
            this.enrichmentEndpoint = url;
            return this;
        }

        public Builder withEnrichmentModel(String model) {
            this.enrichmentModel = model;
            return this;
        }

        /**
         * Default: 5
         */
        public Builder withEnrichmentBatchSize(int size) {
            this.enrichmentBatchSize = size;
            return this;
        }

        /**
         * Default: 10
         */
        public Builder withDeliveryBatchSize(int size) {
            this.deliveryBatchSize = size;
            return this;
        }

        /**
         * Enrichment failures tend to be permanent, so the budget is small.
         * Default: 3
         */
        public Builder withEnrichmentMaxAttempts(int attempts) {
            this.enrichmentMaxAttempts = attempts;
            return this;
        }

        /**
         * Delivery failures tend to be transient.
         * Default: 5
         */
        public Builder withDeliveryMaxAttempts(int attempts) {
            this.deliveryMaxAttempts = attempts;
            return this;
        }

        /**
         * Default: 7 days
         */
        public Builder withQueueRetention(Duration retention) {
            this.queueRetention = retention;
            return this;
        }

        /**
         * The only crash-recovery timeout: a lease held by a dead worker frees itself after this.
         * Default: 15 minutes
         */
        public Builder withLeaseTtl(Duration ttl) {
            this.leaseTtl = ttl;
            return this;
        }

        /**
         * Default: 30 days
         */
        public Builder withDeadLetterRetention(Duration retention) {
            this.deadLetterRetention = retention;
            return this;
        }

        /**
         * After this a subject counts as new again.
         * Default: 90 days
         */
        public Builder withSeenRetention(Duration retention) {
            this.seenRetention = retention;
            return this;
        }

        /**
         * Default: 14 days
         */
        public Builder withEnrichmentCacheRetention(Duration retention) {
            this.enrichmentCacheRetention = retention;
            return this;
        }

        /**
         * Pause between successful deliveries.
         * Default: 200 ms
         */
        public Builder withDeliveryPacing(Duration pacing) {
            this.deliveryPacing = pacing;
            return this;
        }

        public Builder withDiscoveryInterval(Duration interval) {
            this.discoveryInterval = interval;
            return this;
        }

        public Builder withEnrichmentInterval(Duration interval) {
            this.enrichmentInterval = interval;
            return this;
        }

        public Builder withDeliveryInterval(Duration interval) {
            this.deliveryInterval = interval;
            return this;
        }

        /**
         * Default: KEYED
         */
        public Builder withLedgerStrategy(LedgerStrategy strategy) {
            this.ledgerStrategy = strategy;
            return this;
        }

        /**
         * Only used by the consolidated ledger.
         * Default: JSON
         */
        public Builder withLedgerCodec(LedgerCodec codec) {
            this.ledgerCodec = codec;
            return this;
        }

        public PipelineConfig build() {
            if (storage == null) {
                throw new PipelineConfigurationException("No storage configured");
            }
            requirePositive("enrichment batch size", enrichmentBatchSize);
            requirePositive("delivery batch size", deliveryBatchSize);
            requirePositive("enrichment max attempts", enrichmentMaxAttempts);
            requirePositive("delivery max attempts", deliveryMaxAttempts);
            requirePositive("queue retention", queueRetention);
            requirePositive("lease TTL", leaseTtl);
            requirePositive("dead letter retention", deadLetterRetention);
            requirePositive("seen retention", seenRetention);
            requirePositive("enrichment cache retention", enrichmentCacheRetention);
            requirePositive("discovery interval", discoveryInterval);
            requirePositive("enrichment interval", enrichmentInterval);
            requirePositive("delivery interval", deliveryInterval);
            if (deliveryPacing == null || deliveryPacing.isNegative()) {
                throw new PipelineConfigurationException("delivery pacing must not be negative");
            }
            return new PipelineConfig(this);
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new PipelineConfigurationException(name + " must be positive, got " + value);
            }
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new PipelineConfigurationException(name + " must be positive, got " + value);
            }
        }
    }

    /**
     * Property lookup with environment override and typed parsing.
     */
    private static final class Settings {
        private final Properties properties;
        private final Function<String, String> environment;

        Settings(Properties properties, Function<String, String> environment) {
            this.properties = properties;
            this.environment = environment;
        }

        String string(String key, String fallback) {
            String fromEnv = environment.apply(environmentName(key));
            if (fromEnv != null && !fromEnv.isBlank()) {
                return fromEnv.trim();
            }
            String value = properties.getProperty(key);
            return value == null || value.isBlank() ? fallback : value.trim();
        }

        boolean bool(String key, boolean fallback) {
            String value = string(key, null);
            return value == null ? fallback : Boolean.parseBoolean(value);
        }

        int positiveInt(String key, int fallback) {
            String value = string(key, null);
            if (value == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new PipelineConfigurationException("Invalid integer for " + key + ": " + value, e);
            }
        }

        Duration duration(String key, Duration fallback) {
            String value = string(key, null);
            if (value == null) {
                return fallback;
            }
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw new PipelineConfigurationException("Invalid ISO-8601 duration for " + key + ": " + value, e);
            }
        }

        <E extends Enum<E>> E enumValue(String key, Class<E> type, E fallback) {
            String value = string(key, null);
            if (value == null) {
                return fallback;
            }
            try {
                return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new PipelineConfigurationException("Invalid value for " + key + ": " + value, e);
            }
        }
    }
}
