package com.umitunal.pipeq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.pipeq.config.PipelineConfig;
import com.umitunal.pipeq.config.StorageConfig;
import com.umitunal.pipeq.core.QueueMetrics;
import com.umitunal.pipeq.dedup.ConsolidatedSeenLedger;
import com.umitunal.pipeq.dedup.KeyedSeenLedger;
import com.umitunal.pipeq.dedup.SeenDocument;
import com.umitunal.pipeq.dedup.SeenLedger;
import com.umitunal.pipeq.model.DeliveryJob;
import com.umitunal.pipeq.model.EnrichmentJob;
import com.umitunal.pipeq.model.SeenRecord;
import com.umitunal.pipeq.queue.LeaseManager;
import com.umitunal.pipeq.queue.QueueName;
import com.umitunal.pipeq.queue.QueueStore;
import com.umitunal.pipeq.queue.RetryController;
import com.umitunal.pipeq.serialization.JsonCodec;
import com.umitunal.pipeq.serialization.KryoCodec;
import com.umitunal.pipeq.serialization.PayloadCodec;
import com.umitunal.pipeq.stage.DeliveryStage;
import com.umitunal.pipeq.stage.DiscoveryStage;
import com.umitunal.pipeq.stage.EnrichmentStage;
import com.umitunal.pipeq.stage.StageRunner;
import com.umitunal.pipeq.stage.StageTrigger;
import com.umitunal.pipeq.store.InMemoryKeyValueStore;
import com.umitunal.pipeq.store.KeyValueStore;
import com.umitunal.pipeq.store.RocksKeyValueStore;
import com.umitunal.pipeq.store.StoreException;
import com.umitunal.pipeq.transform.DeliveryTransform;
import com.umitunal.pipeq.transform.EnrichmentTransform;
import com.umitunal.pipeq.transform.HttpEnrichmentClient;
import com.umitunal.pipeq.transform.HttpListingSource;
import com.umitunal.pipeq.transform.JsonListingParser;
import com.umitunal.pipeq.transform.ListingParser;
import com.umitunal.pipeq.transform.ListingSource;
import com.umitunal.pipeq.transform.WebhookDelivery;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the store, ledger, queues and stages from configuration.
 *
 * Stages share nothing but the store; each can be run or scheduled on its own.
 */
public class Pipeline implements AutoCloseable {
    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(120);
    private static final int METRICS_SCAN_LIMIT = 10_000;

    private final PipelineConfig config;
    private final KeyValueStore store;
    private final SeenLedger ledger;
    private final QueueStore<EnrichmentJob> enrichmentQueue;
    private final QueueStore<DeliveryJob> deliveryQueue;
    private final LeaseManager leases;
    private final DiscoveryStage discovery;
    private final EnrichmentStage enrichment;
    private final DeliveryStage delivery;

    public Pipeline(PipelineConfig config, KeyValueStore store, ListingSource source, ListingParser parser,
                    EnrichmentTransform enricher, DeliveryTransform deliverer, Clock clock) {
        this.config = config;
        this.store = store;

        ObjectMapper mapper = JsonCodec.defaultMapper();
        this.ledger = createLedger(config, store, clock);
        this.leases = new LeaseManager(store, config.getLeaseTtl(), clock);
        this.enrichmentQueue = new QueueStore<>(store, QueueName.ENRICHMENT, EnrichmentJob.class,
                mapper, config.getQueueRetention(), clock);
        this.deliveryQueue = new QueueStore<>(store, QueueName.DELIVERY, DeliveryJob.class,
                mapper, config.getQueueRetention(), clock);

        RetryController<EnrichmentJob> enrichmentRetries =
                new RetryController<>(enrichmentQueue, leases, config.getDeadLetterRetention(), clock);
        RetryController<DeliveryJob> deliveryRetries =
                new RetryController<>(deliveryQueue, leases, config.getDeadLetterRetention(), clock);

        this.discovery = new DiscoveryStage(config.getListingUrl(), source, parser, ledger, enrichmentQueue, clock);
        this.enrichment = new EnrichmentStage(store, enrichmentRetries, deliveryQueue, enricher,
                config.getEnrichmentBatchSize(), config.getEnrichmentMaxAttempts(),
                config.getEnrichmentCacheRetention(), clock);
        this.delivery = new DeliveryStage(deliveryRetries, deliverer,
                config.getDeliveryBatchSize(), config.getDeliveryMaxAttempts(), config.getDeliveryPacing(), clock);
    }

    /**
     * Open the configured store and wire the HTTP collaborators. Collaborators whose
     * endpoint is not configured are left out; the stage that needs one refuses to run.
     */
    public static Pipeline open(PipelineConfig config) throws StoreException {
        ObjectMapper mapper = JsonCodec.defaultMapper();
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        EnrichmentTransform enricher = config.getEnrichmentEndpoint() == null ? null
                : new HttpEnrichmentClient(http, mapper, config.getEnrichmentEndpoint(),
                        config.getEnrichmentModel(), HTTP_TIMEOUT);
        DeliveryTransform deliverer = config.getWebhookUrl() == null ? null
                : new WebhookDelivery(http, mapper, config.getWebhookUrl(), HTTP_TIMEOUT);

        return new Pipeline(config, openStore(config.getStorage()),
                new HttpListingSource(http, HTTP_TIMEOUT), new JsonListingParser(mapper),
                enricher, deliverer, Clock.systemUTC());
    }

    static KeyValueStore openStore(StorageConfig storage) throws StoreException {
        if (storage.getBackend() == StorageConfig.Backend.MEMORY) {
            return new InMemoryKeyValueStore();
        }
        return new RocksKeyValueStore(storage);
    }

    static SeenLedger createLedger(PipelineConfig config, KeyValueStore store, Clock clock) {
        if (config.getLedgerStrategy() == PipelineConfig.LedgerStrategy.KEYED) {
            return new KeyedSeenLedger(store, new JsonCodec<>(SeenRecord.class), config.getSeenRetention(), clock);
        }
        PayloadCodec<SeenDocument> codec = config.getLedgerCodec() == PipelineConfig.LedgerCodec.KRYO
                ? new KryoCodec<>(SeenDocument.class)
                : new JsonCodec<>(SeenDocument.class);
        return new ConsolidatedSeenLedger(store, codec, config.getSeenRetention(), clock);
    }

    public StageRunner discovery() { return discovery; }
    public StageRunner enrichment() { return enrichment; }
    public StageRunner delivery() { return delivery; }

    public List<StageRunner> stages() {
        return List.of(discovery, enrichment, delivery);
    }

    /**
     * One scheduled trigger per stage, not yet started.
     */
    public List<StageTrigger> triggers() {
        return List.of(
                StageTrigger.builder(discovery).withInterval(config.getDiscoveryInterval()).build(),
                StageTrigger.builder(enrichment).withInterval(config.getEnrichmentInterval()).build(),
                StageTrigger.builder(delivery).withInterval(config.getDeliveryInterval()).build());
    }

    public QueueMetrics metrics() throws StoreException {
        return new QueueMetrics(
                enrichmentQueue.countPending(METRICS_SCAN_LIMIT),
                enrichmentQueue.countDeadLetters(METRICS_SCAN_LIMIT),
                deliveryQueue.countPending(METRICS_SCAN_LIMIT),
                deliveryQueue.countDeadLetters(METRICS_SCAN_LIMIT),
                leases.countLeases(METRICS_SCAN_LIMIT));
    }

    /**
     * Physically remove expired keys. Reads already ignore them; this only reclaims space,
     * and is a no-op for the in-memory store.
     */
    public long purgeExpired() throws StoreException {
        if (store instanceof RocksKeyValueStore) {
            return ((RocksKeyValueStore) store).purgeExpired();
        }
        return 0;
    }

    public SeenLedger ledger() { return ledger; }
    public QueueStore<EnrichmentJob> enrichmentQueue() { return enrichmentQueue; }
    public QueueStore<DeliveryJob> deliveryQueue() { return deliveryQueue; }
    public LeaseManager leases() { return leases; }
    public KeyValueStore store() { return store; }

    @Override
    public void close() {
        store.close();
    }
}
