package com.umitunal.pipeq.stage;

import com.umitunal.pipeq.MutableClock;
import com.umitunal.pipeq.config.PipelineConfigurationException;
import com.umitunal.pipeq.dedup.KeyedSeenLedger;
import com.umitunal.pipeq.dedup.SeenLedger;
import com.umitunal.pipeq.model.EnrichmentJob;
import com.umitunal.pipeq.model.SeenRecord;
import com.umitunal.pipeq.model.Subject;
import com.umitunal.pipeq.queue.QueueName;
import com.umitunal.pipeq.queue.QueueStore;
import com.umitunal.pipeq.serialization.JsonCodec;
import com.umitunal.pipeq.store.InMemoryKeyValueStore;
import com.umitunal.pipeq.transform.JsonListingParser;
import com.umitunal.pipeq.transform.ListingSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class DiscoveryStageTest {

    private static final String LISTING_URL = "https://listing.example.com/calls?page=1";

    private final AtomicReference<String> listing = new AtomicReference<>("[]");
    private MutableClock clock;
    private SeenLedger ledger;
    private QueueStore<EnrichmentJob> enrichmentQueue;
    private DiscoveryStage stage;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-06-01T07:00:00Z");
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
        ledger = new KeyedSeenLedger(store, new JsonCodec<>(SeenRecord.class), Duration.ofDays(90), clock);
        enrichmentQueue = new QueueStore<>(store, QueueName.ENRICHMENT, EnrichmentJob.class,
                JsonCodec.defaultMapper(), Duration.ofDays(7), clock);
        ListingSource source = url -> listing.get();
        stage = new DiscoveryStage(LISTING_URL, source, new JsonListingParser(JsonCodec.defaultMapper()),
                ledger, enrichmentQueue, clock);
    }

    @Test
    @DisplayName("Should enqueue new subjects once and mark them seen")
    void testEnqueueNewSubjects() throws Exception {
        // Given
        listing.set("[{\"url\":\"/calls/1\",\"title\":\"One\"},{\"url\":\"/calls/2\",\"title\":\"Two\"}]");

        // When
        StageReport report = stage.runOnce();

        // Then
        assertThat(report.getStage()).isEqualTo("Discovery");
        assertThat(report.getProcessed()).isEqualTo(2);
        assertThat(report.getSucceeded()).isEqualTo(2);
        assertThat(enrichmentQueue.listPending(10)).hasSize(2);
        assertThat(ledger.isSeen("https://listing.example.com/calls/1")).isTrue();
        assertThat(ledger.isSeen("https://listing.example.com/calls/2")).isTrue();
    }

    @Test
    @DisplayName("Should skip subjects seen on a previous run")
    void testRepeatedRunIsDeduplicated() throws Exception {
        listing.set("[{\"url\":\"/calls/1\"},{\"url\":\"/calls/2\"}]");
        stage.runOnce();

        clock.advance(Duration.ofHours(1));
        listing.set("[{\"url\":\"/calls/1\"},{\"url\":\"/calls/2\"},{\"url\":\"/calls/3\"}]");
        StageReport second = stage.runOnce();

        assertThat(second.getSucceeded()).isEqualTo(1);
        assertThat(second.getSkipped()).isEqualTo(2);
        assertThat(enrichmentQueue.listPending(10)).hasSize(3);
    }

    @Test
    @DisplayName("Should treat a subject as new again after the ledger forgets it")
    void testSeenRetentionLapses() throws Exception {
        listing.set("[{\"url\":\"/calls/1\"}]");
        stage.runOnce();

        clock.advance(Duration.ofDays(90));
        StageReport report = stage.runOnce();

        assertThat(report.getSucceeded()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should carry the parsed subject into the queued job")
    void testJobContent() throws Exception {
        listing.set("{\"items\":[{\"url\":\"/calls/7\",\"title\":\"Seven\",\"identifier\":\"C-7\",\"deadline\":\"2026-12-01\"}]}");

        stage.runOnce();

        String key = enrichmentQueue.listPending(10).get(0);
        EnrichmentJob job = enrichmentQueue.getJob(key).orElseThrow();
        Subject subject = job.getSubject();
        assertThat(subject.getUrl()).isEqualTo("https://listing.example.com/calls/7");
        assertThat(subject.getIdentifier()).isEqualTo("C-7");
        assertThat(subject.getAttributes()).containsEntry("deadline", "2026-12-01");
        assertThat(job.getEnqueued()).isEqualTo(clock.instant());
        assertThat(job.getAttempts()).isZero();
    }

    @Test
    @DisplayName("Should refuse to run without a listing URL")
    void testMissingListingUrl() {
        DiscoveryStage unconfigured = new DiscoveryStage(" ", url -> "[]",
                new JsonListingParser(JsonCodec.defaultMapper()), ledger, enrichmentQueue, clock);

        assertThatThrownBy(unconfigured::runOnce)
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessage("No listing URL configured");
    }

    @Test
    @DisplayName("Should let a failed fetch abort the run without touching the ledger")
    void testFetchFailure() {
        DiscoveryStage failing = new DiscoveryStage(LISTING_URL, url -> {
            throw new IOException("Listing fetch failed: 502");
        }, (raw, base) -> List.of(), ledger, enrichmentQueue, clock);

        assertThatThrownBy(failing::runOnce).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should resolve relative links against the listing origin")
    void testOrigin() {
        assertThat(DiscoveryStage.origin("https://listing.example.com/calls?page=1")).isEqualTo("https://listing.example.com/");
        assertThat(DiscoveryStage.origin("http://localhost:8080/a/b")).isEqualTo("http://localhost:8080/");
    }
}
