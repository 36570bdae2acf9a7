package com.umitunal.pipeq.stage;

import com.umitunal.pipeq.config.PipelineConfigurationException;
import com.umitunal.pipeq.dedup.SeenLedger;
import com.umitunal.pipeq.model.EnrichmentJob;
import com.umitunal.pipeq.model.Subject;
import com.umitunal.pipeq.queue.QueueStore;
import com.umitunal.pipeq.store.StoreException;
import com.umitunal.pipeq.transform.ListingParser;
import com.umitunal.pipeq.transform.ListingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fetches the listing, drops subjects the ledger has already seen and enqueues the rest
 * for enrichment.
 *
 * Subjects are marked seen only after they were enqueued. A crash in between means the next
 * run enqueues them again, which downstream tolerates; the reverse order could lose them.
 */
public class DiscoveryStage implements StageRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryStage.class);

    private final String listingUrl;
    private final ListingSource source;
    private final ListingParser parser;
    private final SeenLedger ledger;
    private final QueueStore<EnrichmentJob> enrichmentQueue;
    private final Clock clock;

    public DiscoveryStage(String listingUrl, ListingSource source, ListingParser parser,
                          SeenLedger ledger, QueueStore<EnrichmentJob> enrichmentQueue, Clock clock) {
        this.listingUrl = listingUrl;
        this.source = source;
        this.parser = parser;
        this.ledger = ledger;
        this.enrichmentQueue = enrichmentQueue;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "Discovery";
    }

    @Override
    public StageReport runOnce() throws Exception {
        if (listingUrl == null || listingUrl.isBlank()) {
            throw new PipelineConfigurationException("No listing URL configured");
        }
        if (ledger == null || enrichmentQueue == null) {
            throw new PipelineConfigurationException("No key-value store configured");
        }

        long start = clock.millis();
        StageReport.Tally tally = new StageReport.Tally();

        log.info("Fetching listing from {}", listingUrl);
        String raw = source.fetch(listingUrl);
        List<Subject> subjects = parser.parse(raw, origin(listingUrl));
        log.info("Parsed {} subjects", subjects.size());

        Set<String> seen = ledger.filterSeen(subjects.stream().map(Subject::getUrl).collect(Collectors.toList()));
        Set<String> enqueuedUrls = new HashSet<>();
        List<Subject> enqueued = new ArrayList<>();

        for (Subject subject : subjects) {
            tally.processed++;

            if (seen.contains(subject.getUrl()) || !enqueuedUrls.add(subject.getUrl())) {
                tally.skipped++;
                continue;
            }

            try {
                enrichmentQueue.enqueue(subject.getUrl(), new EnrichmentJob(subject, Instant.now(clock)));
                enqueued.add(subject);
                tally.succeeded++;
                log.info("Enqueued new subject: {}", subject.label());
            } catch (StoreException e) {
                tally.failed++;
                enqueuedUrls.remove(subject.getUrl());
                log.error("Failed to enqueue {}", subject.getUrl(), e);
            }
        }

        ledger.markSeenBatch(enqueued);

        StageReport report = tally.toReport(name(), Duration.ofMillis(clock.millis() - start));
        log.info("{}", report);
        return report;
    }

    /**
     * Scheme and authority of the listing URL, used to resolve relative links.
     */
    static String origin(String url) {
        URI uri = URI.create(url);
        return uri.getScheme() + "://" + uri.getRawAuthority() + "/";
    }
}
