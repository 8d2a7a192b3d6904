package com.phillippitts.branchplayer.service.metrics;

import com.phillippitts.branchplayer.domain.Choice;
import com.phillippitts.branchplayer.domain.Phase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlaybackMetricsTest {

    private MeterRegistry registry;
    private PlaybackMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PlaybackMetrics(registry);
    }

    @Test
    void shouldCountBundlesPerPhase() {
        metrics.recordBundleStarted(Phase.QUESTION);
        metrics.recordBundleStarted(Phase.QUESTION);
        metrics.recordBundleStarted(Phase.OUTCOME_FAILURE);

        Counter question = registry.find("branchplayer.flow.bundles.started").tag("phase", "question").counter();
        Counter failure = registry.find("branchplayer.flow.bundles.started").tag("phase", "outcome_failure").counter();

        assertThat(question).isNotNull();
        assertThat(question.count()).isEqualTo(2.0);
        assertThat(failure.count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagStaleSignalsByKind() {
        metrics.recordStaleSignal("prepared");
        metrics.recordStaleSignal("finished");
        metrics.recordStaleSignal("finished");

        assertThat(registry.find("branchplayer.flow.signals.stale").tag("signal", "finished").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountChoices() {
        metrics.recordChoice(Choice.SUCCESS);
        metrics.recordIgnoredChoice();

        assertThat(registry.find("branchplayer.flow.choices.accepted").tag("choice", "success").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("branchplayer.flow.choices.ignored").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldAddDroppedCaptionBlocks() {
        metrics.recordDroppedCaptionBlocks(3);
        metrics.recordDroppedCaptionBlocks(2);

        assertThat(registry.find("branchplayer.flow.captions.dropped-blocks").counter().count()).isEqualTo(5.0);
    }

    @Test
    void shouldSkipZeroDroppedBlocks() {
        metrics.recordDroppedCaptionBlocks(0);

        assertThat(registry.find("branchplayer.flow.captions.dropped-blocks").counter()).isNull();
    }

    @Test
    void shouldCountCompletedSequences() {
        metrics.recordSequenceCompleted();

        assertThat(registry.find("branchplayer.flow.sequence.completed").counter().count()).isEqualTo(1.0);
    }
}
