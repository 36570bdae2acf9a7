package com.umitunal.pipeq.stage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class StageTriggerTest {

    @Test
    @DisplayName("Should run the stage once on a manual trigger")
    void testManualTrigger() throws Exception {
        CountingStage stage = new CountingStage(false);
        StageTrigger trigger = StageTrigger.builder(stage).build();

        StageReport report = trigger.runOnce();

        assertThat(report.getStage()).isEqualTo("Counting");
        assertThat(stage.runs).hasValue(1);
        assertThat(trigger.getCompletedRuns()).isEqualTo(1);
        assertThat(trigger.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should propagate failures from a manual trigger")
    void testManualFailure() {
        StageTrigger trigger = StageTrigger.builder(new CountingStage(true)).build();

        assertThatThrownBy(trigger::runOnce).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should fire repeatedly on its schedule")
    void testScheduled() {
        CountingStage stage = new CountingStage(false);

        try (StageTrigger trigger = StageTrigger.builder(stage)
                .withInterval(Duration.ofMillis(50))
                .build()) {
            trigger.start();
            trigger.start();

            await().atMost(5, TimeUnit.SECONDS).until(() -> stage.runs.get() >= 3);
            assertThat(trigger.isRunning()).isTrue();
            assertThat(trigger.getStageName()).isEqualTo("Counting");
        }
    }

    @Test
    @DisplayName("Should keep the schedule alive after a failed run")
    void testScheduledFailureContinues() {
        CountingStage stage = new CountingStage(true);

        StageTrigger trigger = StageTrigger.builder(stage)
                .withInterval(Duration.ofMillis(50))
                .build();
        try {
            trigger.start();

            await().atMost(5, TimeUnit.SECONDS).until(() -> trigger.getFailedRuns() >= 2);
            assertThat(trigger.getCompletedRuns()).isZero();
        } finally {
            trigger.stop();
        }
        assertThat(trigger.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject a non-positive interval")
    void testInvalidInterval() {
        assertThatThrownBy(() -> StageTrigger.builder(new CountingStage(false)).withInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class CountingStage implements StageRunner {
        private final AtomicInteger runs = new AtomicInteger();
        private final boolean fail;

        CountingStage(boolean fail) {
            this.fail = fail;
        }

        @Override
        public String name() {
            return "Counting";
        }

        @Override
        public StageReport runOnce() {
            runs.incrementAndGet();
            if (fail) {
                throw new IllegalStateException("stage broke");
            }
            return new StageReport(name(), 0, 0, 0, 0, Duration.ZERO);
        }
    }
}
