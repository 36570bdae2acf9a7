package com.umitunal.pipeq.stage;

import com.umitunal.pipeq.MutableClock;
import com.umitunal.pipeq.config.PipelineConfigurationException;
import com.umitunal.pipeq.model.DeadLetterEntry;
import com.umitunal.pipeq.model.DeliveryJob;
import com.umitunal.pipeq.model.EnrichmentJob;
import com.umitunal.pipeq.model.Subject;
import com.umitunal.pipeq.queue.LeaseManager;
import com.umitunal.pipeq.queue.QueueKeys;
import com.umitunal.pipeq.queue.QueueName;
import com.umitunal.pipeq.queue.QueueStore;
import com.umitunal.pipeq.queue.RetryController;
import com.umitunal.pipeq.queue.SubjectHash;
import com.umitunal.pipeq.serialization.JsonCodec;
import com.umitunal.pipeq.store.InMemoryKeyValueStore;
import com.umitunal.pipeq.transform.EnrichmentTransform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class EnrichmentStageTest {

    private static final String URL = "https://example.com/calls/1";

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private QueueStore<EnrichmentJob> enrichmentQueue;
    private QueueStore<DeliveryJob> deliveryQueue;
    private LeaseManager leases;
    private RetryController<EnrichmentJob> retries;
    private final AtomicInteger calls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-06-01T07:00:00Z");
        store = new InMemoryKeyValueStore(clock);
        enrichmentQueue = new QueueStore<>(store, QueueName.ENRICHMENT, EnrichmentJob.class,
                JsonCodec.defaultMapper(), Duration.ofDays(7), clock);
        deliveryQueue = new QueueStore<>(store, QueueName.DELIVERY, DeliveryJob.class,
                JsonCodec.defaultMapper(), Duration.ofDays(7), clock);
        leases = new LeaseManager(store, Duration.ofMinutes(15), clock);
        retries = new RetryController<>(enrichmentQueue, leases, Duration.ofDays(30), clock);
    }

    @Test
    @DisplayName("Should enrich a job and hand it to delivery")
    void testHandOff() throws Exception {
        // Given
        String key = enrichmentQueue.enqueue(URL, job());
        EnrichmentStage stage = stage((url, subject) -> {
            calls.incrementAndGet();
            return Optional.of("Summary of " + subject.getTitle());
        });

        // When
        StageReport report = stage.runOnce();

        // Then
        assertThat(report.getSucceeded()).isEqualTo(1);
        assertThat(enrichmentQueue.getJob(key)).isEmpty();
        assertThat(leases.isLeased(URL)).isFalse();
        String deliveryKey = deliveryQueue.listPending(10).get(0);
        DeliveryJob delivery = deliveryQueue.getJob(deliveryKey).orElseThrow();
        assertThat(delivery.getEnrichedText()).isEqualTo("Summary of Call one");
        assertThat(delivery.getSubject().getIdentifier()).isEqualTo("C-1");
        assertThat(delivery.getEnriched()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Should reuse cached text instead of generating it again")
    void testCacheHit() throws Exception {
        store.put(QueueKeys.enrichedKey(URL), "cached text".getBytes(StandardCharsets.UTF_8),
                Duration.ofDays(14));
        enrichmentQueue.enqueue(URL, job());
        EnrichmentStage stage = stage((url, subject) -> {
            calls.incrementAndGet();
            return Optional.of("fresh text");
        });

        stage.runOnce();

        assertThat(calls).hasValue(0);
        DeliveryJob delivery = deliveryQueue.getJob(deliveryQueue.listPending(1).get(0)).orElseThrow();
        assertThat(delivery.getEnrichedText()).isEqualTo("cached text");
    }

    @Test
    @DisplayName("Should count an empty result as a failed attempt")
    void testEmptyResult() throws Exception {
        String key = enrichmentQueue.enqueue(URL, job());
        EnrichmentStage stage = stage((url, subject) -> Optional.empty());

        StageReport report = stage.runOnce();

        assertThat(report.getFailed()).isEqualTo(1);
        EnrichmentJob job = enrichmentQueue.getJob(key).orElseThrow();
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getError()).isEqualTo("Failed to enrich (no text returned)");
        assertThat(leases.isLeased(URL)).isFalse();
        assertThat(deliveryQueue.listPending(10)).isEmpty();
    }

    @Test
    @DisplayName("Should dead-letter after the attempt budget is spent")
    void testDeadLetter() throws Exception {
        String key = enrichmentQueue.enqueue(URL, job());
        EnrichmentStage stage = stage((url, subject) -> {
            throw new IllegalStateException("model unavailable");
        });

        for (int run = 0; run < 3; run++) {
            stage.runOnce();
            clock.advance(Duration.ofMinutes(15));
        }

        assertThat(enrichmentQueue.getJob(key)).isEmpty();
        DeadLetterEntry<EnrichmentJob> entry = enrichmentQueue.getDeadLetter(URL).orElseThrow();
        assertThat(entry.getAttempts()).isEqualTo(3);
        assertThat(entry.getLastError()).isEqualTo("model unavailable");
        assertThat(stage.runOnce().getProcessed()).isZero();
    }

    @Test
    @DisplayName("Should skip a job whose subject is leased elsewhere")
    void testAlreadyClaimed() throws Exception {
        String key = enrichmentQueue.enqueue(URL, job());
        leases.claim(URL);
        EnrichmentStage stage = stage((url, subject) -> {
            calls.incrementAndGet();
            return Optional.of("text");
        });

        StageReport report = stage.runOnce();

        assertThat(report.getProcessed()).isEqualTo(1);
        assertThat(report.getSkipped()).isEqualTo(1);
        assertThat(calls).hasValue(0);
        assertThat(enrichmentQueue.getJob(key)).isPresent();
    }

    @Test
    @DisplayName("Should process at most one batch per run, oldest first")
    void testBatchLimit() throws Exception {
        for (int i = 0; i < 4; i++) {
            String url = "https://example.com/calls/b" + i;
            enrichmentQueue.enqueue(url, new EnrichmentJob(new Subject(url, "B" + i, null), clock.instant()));
            clock.advance(Duration.ofSeconds(1));
        }
        EnrichmentStage stage = new EnrichmentStage(store, retries, deliveryQueue,
                (url, subject) -> Optional.of(subject.getTitle()), 3, 3, Duration.ofDays(14), clock);

        StageReport report = stage.runOnce();

        assertThat(report.getSucceeded()).isEqualTo(3);
        String remaining = enrichmentQueue.listPending(10).get(0);
        assertThat(enrichmentQueue.getJob(remaining).orElseThrow().getSubject().getTitle()).isEqualTo("B3");
    }

    @Test
    @DisplayName("Should refuse to run without an enrichment endpoint")
    void testMissingTransform() throws Exception {
        String key = enrichmentQueue.enqueue(URL, job());
        EnrichmentStage stage = stage(null);

        assertThatThrownBy(stage::runOnce)
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessage("No enrichment endpoint configured");
        assertThat(enrichmentQueue.getJob(key).orElseThrow().getAttempts()).isZero();
    }

    @Test
    @DisplayName("Should not share cached text between subjects whose hashes collide")
    void testCacheKeyedByUrl() throws Exception {
        // Given: "Aa" and "BB" hash alike, so both URLs land on the same hash
        String first = "https://x.example/Aa";
        String second = "https://x.example/BB";
        assertThat(SubjectHash.of(first)).isEqualTo(SubjectHash.of(second));
        EnrichmentStage stage = stage((url, subject) -> {
            calls.incrementAndGet();
            return Optional.of("text for " + url);
        });

        // When
        enrichmentQueue.enqueue(first, new EnrichmentJob(new Subject(first, "Aa", null), clock.instant()));
        stage.runOnce();
        clock.advance(Duration.ofSeconds(1));
        enrichmentQueue.enqueue(second, new EnrichmentJob(new Subject(second, "BB", null), clock.instant()));
        stage.runOnce();

        // Then
        assertThat(calls).hasValue(2);
        assertThat(deliveryQueue.listPending(10)).hasSize(2);
        String latest = deliveryQueue.listPending(10).get(1);
        assertThat(deliveryQueue.getJob(latest).orElseThrow().getEnrichedText()).isEqualTo("text for " + second);
    }

    @Test
    @DisplayName("Should quarantine an entry without a subject and keep processing the batch")
    void testEntryWithoutSubject() throws Exception {
        // Given: a payload with no subject sorts ahead of a valid job
        String badKey = QueueName.ENRICHMENT.prefix() + "0000000000001:abc";
        store.put(badKey, "{\"attempts\":0}".getBytes(StandardCharsets.UTF_8), Duration.ofDays(7));
        String goodKey = enrichmentQueue.enqueue(URL, job());
        EnrichmentStage stage = stage((url, subject) -> Optional.of("text"));

        // When
        StageReport report = stage.runOnce();

        // Then
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getSucceeded()).isEqualTo(1);
        assertThat(enrichmentQueue.getJob(goodKey)).isEmpty();
        assertThat(deliveryQueue.listPending(10)).hasSize(1);
        assertThat(store.get(badKey)).isEmpty();
        assertThat(enrichmentQueue.getQuarantined(badKey))
                .hasValueSatisfying(raw -> assertThat(new String(raw, StandardCharsets.UTF_8)).isEqualTo("{\"attempts\":0}"));

        // And: the next run no longer sees it
        assertThat(stage.runOnce().getProcessed()).isZero();
    }

    @Test
    @DisplayName("Should quarantine an entry that is not valid JSON")
    void testUndecodableEntry() throws Exception {
        String badKey = QueueName.ENRICHMENT.prefix() + "0000000000001:xyz";
        store.put(badKey, "{not json".getBytes(StandardCharsets.UTF_8), Duration.ofDays(7));
        enrichmentQueue.enqueue(URL, job());
        EnrichmentStage stage = stage((url, subject) -> Optional.of("text"));

        StageReport report = stage.runOnce();

        assertThat(report.getProcessed()).isEqualTo(2);
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getSucceeded()).isEqualTo(1);
        assertThat(enrichmentQueue.listPending(10)).isEmpty();
        assertThat(enrichmentQueue.countQuarantined(10)).isEqualTo(1);
        assertThat(enrichmentQueue.countDeadLetters(10)).isZero();
    }

    private EnrichmentStage stage(EnrichmentTransform transform) {
        return new EnrichmentStage(store, retries, deliveryQueue, transform, 5, 3, Duration.ofDays(14), clock);
    }

    private EnrichmentJob job() {
        return new EnrichmentJob(new Subject(URL, "Call one", "C-1"), clock.instant());
    }
}
