package com.umitunal.pipeq;

import com.umitunal.pipeq.config.PipelineConfig;
import com.umitunal.pipeq.config.StorageConfig;
import com.umitunal.pipeq.core.QueueMetrics;
import com.umitunal.pipeq.dedup.ConsolidatedSeenLedger;
import com.umitunal.pipeq.dedup.KeyedSeenLedger;
import com.umitunal.pipeq.model.DeliveryJob;
import com.umitunal.pipeq.serialization.JsonCodec;
import com.umitunal.pipeq.stage.StageReport;
import com.umitunal.pipeq.stage.StageTrigger;
import com.umitunal.pipeq.store.InMemoryKeyValueStore;
import com.umitunal.pipeq.transform.JsonListingParser;
import com.umitunal.pipeq.transform.RateLimitedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class PipelineTest {

    private static final String LISTING =
            "{\"items\":["
                    + "{\"url\":\"/calls/1\",\"title\":\"Clean water\",\"identifier\":\"CW-1\"},"
                    + "{\"url\":\"/calls/2\",\"title\":\"Smart grids\",\"identifier\":\"SG-2\"},"
                    + "{\"url\":\"/calls/3\",\"title\":\"Urban farming\",\"identifier\":\"UF-3\"}"
                    + "]}";

    private MutableClock clock;
    private final List<DeliveryJob> delivered = new CopyOnWriteArrayList<>();
    private final AtomicBoolean rateLimited = new AtomicBoolean(false);

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-07-01T06:00:00Z");
    }

    @Test
    @DisplayName("Should carry subjects from discovery through enrichment to delivery")
    void testEndToEnd() throws Exception {
        try (Pipeline pipeline = pipeline(PipelineConfig.newBuilder()
                .withListingUrl("https://funding.example.com/open?sort=new")
                .withDeliveryPacing(Duration.ZERO)
                .build())) {

            // When
            StageReport discovered = pipeline.discovery().runOnce();
            clock.advance(Duration.ofMinutes(1));
            StageReport firstEnrichment = pipeline.enrichment().runOnce();
            StageReport secondEnrichment = pipeline.enrichment().runOnce();
            StageReport deliveredReport = pipeline.delivery().runOnce();

            // Then
            assertThat(discovered.getSucceeded()).isEqualTo(3);
            assertThat(firstEnrichment.getSucceeded()).isEqualTo(3);
            assertThat(secondEnrichment.getProcessed()).isZero();
            assertThat(deliveredReport.getSucceeded()).isEqualTo(3);
            assertThat(delivered).extracting(DeliveryJob::getEnrichedText)
                    .containsExactlyInAnyOrder("About Clean water", "About Smart grids", "About Urban farming");
            assertThat(delivered).extracting(job -> job.getSubject().getUrl())
                    .contains("https://funding.example.com/calls/1");

            QueueMetrics metrics = pipeline.metrics();
            assertThat(metrics.getEnrichmentPending()).isZero();
            assertThat(metrics.getDeliveryPending()).isZero();
            assertThat(metrics.getActiveLeases()).isZero();
            assertThat(metrics.getDeliveryDeadLettered()).isZero();
        }
    }

    @Test
    @DisplayName("Should not enqueue the same listing twice")
    void testRediscoveryIsIdempotent() throws Exception {
        try (Pipeline pipeline = pipeline(PipelineConfig.newBuilder()
                .withListingUrl("https://funding.example.com/open")
                .build())) {

            pipeline.discovery().runOnce();
            pipeline.enrichment().runOnce();
            StageReport second = pipeline.discovery().runOnce();

            assertThat(second.getSucceeded()).isZero();
            assertThat(second.getSkipped()).isEqualTo(3);
            assertThat(pipeline.metrics().getEnrichmentPending()).isZero();
            assertThat(pipeline.metrics().getDeliveryPending()).isEqualTo(3);
        }
    }

    @Test
    @DisplayName("Should leave rate-limited deliveries queued for the next run")
    void testRateLimitKeepsJobs() throws Exception {
        try (Pipeline pipeline = pipeline(PipelineConfig.newBuilder()
                .withListingUrl("https://funding.example.com/open")
                .withDeliveryPacing(Duration.ZERO)
                .build())) {
            pipeline.discovery().runOnce();
            pipeline.enrichment().runOnce();

            rateLimited.set(true);
            StageReport limited = pipeline.delivery().runOnce();
            rateLimited.set(false);
            StageReport recovered = pipeline.delivery().runOnce();

            assertThat(limited.getSkipped()).isEqualTo(3);
            assertThat(recovered.getSucceeded()).isEqualTo(3);
            assertThat(delivered).allSatisfy(job -> assertThat(job.getAttempts()).isZero());
        }
    }

    @Test
    @DisplayName("Should pick the ledger layout from configuration")
    void testLedgerSelection() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);

        assertThat(Pipeline.createLedger(PipelineConfig.newBuilder().build(), store, clock))
                .isInstanceOf(KeyedSeenLedger.class);
        assertThat(Pipeline.createLedger(PipelineConfig.newBuilder()
                .withLedgerStrategy(PipelineConfig.LedgerStrategy.CONSOLIDATED)
                .withLedgerCodec(PipelineConfig.LedgerCodec.KRYO)
                .build(), store, clock))
                .isInstanceOf(ConsolidatedSeenLedger.class);
    }

    @Test
    @DisplayName("Should build one trigger per stage")
    void testTriggers() throws Exception {
        try (Pipeline pipeline = pipeline(PipelineConfig.newBuilder().build())) {
            assertThat(pipeline.triggers()).extracting(StageTrigger::getStageName)
                    .containsExactly("Discovery", "Enrichment", "Delivery");
        }
    }

    @Test
    @DisplayName("Should open a RocksDB-backed pipeline from configuration")
    void testOpenWithRocks(@TempDir Path dataDir) throws Exception {
        PipelineConfig config = PipelineConfig.newBuilder()
                .withStorage(StorageConfig.newBuilder(dataDir.toString()).withDurableWrites(false).build())
                .build();

        try (Pipeline pipeline = Pipeline.open(config)) {
            assertThat(pipeline.metrics().getEnrichmentPending()).isZero();
            assertThat(pipeline.purgeExpired()).isZero();
            assertThatThrownBy(() -> pipeline.delivery().runOnce())
                    .hasMessage("No webhook URL configured");
        }
    }

    private Pipeline pipeline(PipelineConfig config) {
        return new Pipeline(config, new InMemoryKeyValueStore(clock),
                url -> LISTING,
                new JsonListingParser(JsonCodec.defaultMapper()),
                (url, subject) -> Optional.of("About " + subject.getTitle()),
                job -> {
                    if (rateLimited.get()) {
                        throw new RateLimitedException("rate limit", null);
                    }
                    delivered.add(job);
                },
                clock);
    }
}
