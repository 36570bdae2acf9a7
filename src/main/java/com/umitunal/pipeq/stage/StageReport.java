package com.umitunal.pipeq.stage;

import java.time.Duration;

/**
 * Counters from a single stage run.
 */
public class StageReport {
    private final String stage;
    private final int processed;
    private final int succeeded;
    private final int failed;
    private final int skipped;
    private final Duration duration;

    public StageReport(String stage, int processed, int succeeded, int failed, int skipped, Duration duration) {
        this.stage = stage;
        this.processed = processed;
        this.succeeded = succeeded;
        this.failed = failed;
        this.skipped = skipped;
        this.duration = duration;
    }

    public String getStage() { return stage; }
    public int getProcessed() { return processed; }
    public int getSucceeded() { return succeeded; }
    public int getFailed() { return failed; }
    public int getSkipped() { return skipped; }
    public Duration getDuration() { return duration; }

    @Override
    public String toString() {
        return String.format("%s complete in %dms - Processed: %d, Succeeded: %d, Failed: %d, Skipped: %d",
                stage, duration.toMillis(), processed, succeeded, failed, skipped);
    }

    /**
     * Mutable tally used while a run is in progress.
     */
    static final class Tally {
        int processed;
        int succeeded;
        int failed;
        int skipped;

        StageReport toReport(String stage, Duration duration) {
            return new StageReport(stage, processed, succeeded, failed, skipped, duration);
        }
    }
}
