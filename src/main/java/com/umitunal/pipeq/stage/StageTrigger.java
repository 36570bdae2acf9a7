package com.umitunal.pipeq.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fires a stage manually or on a fixed cadence. Both paths call the same
 * {@link StageRunner#runOnce()}.
 *
 * Scheduled runs use a single thread with a fixed delay, so a stage never overlaps itself
 * within one process. A failed scheduled run is logged and the next tick goes ahead as usual.
 */
public class StageTrigger implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StageTrigger.class);

    private final StageRunner stage;
    private final Duration interval;
    private final Duration initialDelay;
    private final AtomicBoolean running;
    private final AtomicLong completedRuns;
    private final AtomicLong failedRuns;

    private ScheduledExecutorService scheduler;

    private StageTrigger(Builder builder) {
        this.stage = builder.stage;
        this.interval = builder.interval;
        this.initialDelay = builder.initialDelay;
        this.running = new AtomicBoolean(false);
        this.completedRuns = new AtomicLong(0);
        this.failedRuns = new AtomicLong(0);
    }

    /**
     * Manual trigger. Failures propagate to the caller.
     */
    public StageReport runOnce() throws Exception {
        log.info("[{}] Manual trigger requested", stage.name());
        StageReport report = stage.runOnce();
        completedRuns.incrementAndGet();
        return report;
    }

    /**
     * Start firing the stage every {@code interval}.
     */
    public synchronized void start() {
        if (running.compareAndSet(false, true)) {
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "StageTrigger-" + stage.name());
                thread.setDaemon(false);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::scheduledRun,
                    initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[{}] Scheduled every {}", stage.name(), interval);
        }
    }

    /**
     * Stop scheduling and wait briefly for an in-flight run. An interrupted run leaves its
     * lease to expire.
     */
    public synchronized void stop() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void scheduledRun() {
        log.info("[{}] Scheduled event triggered", stage.name());
        try {
            stage.runOnce();
            completedRuns.incrementAndGet();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted", stage.name());
        } catch (Exception e) {
            // The next tick retries; throwing here would cancel the schedule
            failedRuns.incrementAndGet();
            log.error("[{}] Failed: {}", stage.name(), e.getMessage(), e);
        }
    }

    public String getStageName() { return stage.name(); }
    public long getCompletedRuns() { return completedRuns.get(); }
    public long getFailedRuns() { return failedRuns.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(StageRunner stage) {
        return new Builder(stage);
    }

    public static class Builder {
        private final StageRunner stage;
        private Duration interval = Duration.ofMinutes(15);
        private Duration initialDelay = Duration.ZERO;

        private Builder(StageRunner stage) {
            this.stage = stage;
        }

        public Builder withInterval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder withInitialDelay(Duration delay) {
            this.initialDelay = delay;
            return this;
        }

        public StageTrigger build() {
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be positive: " + interval);
            }
            return new StageTrigger(this);
        }
    }
}
