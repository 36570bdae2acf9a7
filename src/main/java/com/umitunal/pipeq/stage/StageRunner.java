package com.umitunal.pipeq.stage;

/**
 * One pipeline stage. Each invocation is short-lived and keeps no state between runs;
 * everything it needs is read from the store.
 */
public interface StageRunner {

    String name();

    /**
     * Run the stage once.
     *
     * Per-job failures are absorbed and reported in the result. Only structural problems
     * (missing configuration, store unavailable while listing) escape.
     */
    StageReport runOnce() throws Exception;
}
