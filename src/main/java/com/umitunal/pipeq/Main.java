package com.umitunal.pipeq;

import com.umitunal.pipeq.config.PipelineConfig;
import com.umitunal.pipeq.model.DeadLetterEntry;
import com.umitunal.pipeq.stage.StageRunner;
import com.umitunal.pipeq.stage.StageTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * <pre>
 *   pipeq discover|enrich|deliver   run one stage once
 *   pipeq all                       run every stage once, in pipeline order
 *   pipeq schedule                  run every stage on its configured cadence until killed
 *   pipeq status                    print queue counts
 *   pipeq dlq                       print dead letters
 *   pipeq purge                     reclaim space held by expired keys
 * </pre>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final int DLQ_PRINT_LIMIT = 50;

    public static void main(String[] args) throws Exception {
        String command = args.length > 0 ? args[0] : "all";
        PipelineConfig config = PipelineConfig.load();

        try (Pipeline pipeline = Pipeline.open(config)) {
            switch (command) {
                case "discover" -> run(pipeline.discovery());
                case "enrich" -> run(pipeline.enrichment());
                case "deliver" -> run(pipeline.delivery());
                case "all" -> {
                    for (StageRunner stage : pipeline.stages()) {
                        run(stage);
                    }
                }
                case "schedule" -> schedule(pipeline);
                case "status" -> System.out.println(pipeline.metrics());
                case "dlq" -> printDeadLetters(pipeline);
                case "purge" -> System.out.println("Purged " + pipeline.purgeExpired() + " expired keys");
                default -> {
                    System.err.println("Unknown command: " + command);
                    System.err.println("Usage: pipeq [discover|enrich|deliver|all|schedule|status|dlq|purge]");
                    System.exit(2);
                }
            }
        }
    }

    private static void run(StageRunner stage) throws Exception {
        System.out.println(StageTrigger.builder(stage).build().runOnce());
    }

    private static void schedule(Pipeline pipeline) throws InterruptedException {
        List<StageTrigger> triggers = pipeline.triggers();
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down triggers");
            triggers.forEach(StageTrigger::stop);
            shutdown.countDown();
        }, "pipeq-shutdown"));

        triggers.forEach(StageTrigger::start);
        shutdown.await();
    }

    private static void printDeadLetters(Pipeline pipeline) throws Exception {
        System.out.println("== Enrichment dead letters");
        for (DeadLetterEntry<?> entry : pipeline.enrichmentQueue().listDeadLetters(DLQ_PRINT_LIMIT)) {
            System.out.println("  " + entry);
        }
        System.out.println("== Delivery dead letters");
        for (DeadLetterEntry<?> entry : pipeline.deliveryQueue().listDeadLetters(DLQ_PRINT_LIMIT)) {
            System.out.println("  " + entry);
        }
    }
}
