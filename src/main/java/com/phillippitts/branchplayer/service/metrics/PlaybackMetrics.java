package com.phillippitts.branchplayer.service.metrics;

import com.phillippitts.branchplayer.domain.Choice;
import com.phillippitts.branchplayer.domain.Phase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized metrics for the branching flow.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Bundles started per phase</li>
 *   <li>Stale media signals discarded and choices ignored</li>
 *   <li>Malformed caption blocks dropped</li>
 *   <li>Completed sequences</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PlaybackMetrics {

    private static final String METRIC_PREFIX = "branchplayer.flow";

    private final MeterRegistry registry;

    public PlaybackMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the bundle counter for a phase.
     */
    public void recordBundleStarted(Phase phase) {
        Counter.builder(METRIC_PREFIX + ".bundles.started")
                .description("Number of media bundles loaded")
                .tag("phase", tagValue(phase.name()))
                .register(registry)
                .increment();
    }

    /**
     * Counts a prepared/finished signal discarded because its bundle was superseded.
     *
     * @param signal signal kind (prepared, finished)
     */
    public void recordStaleSignal(String signal) {
        Counter.builder(METRIC_PREFIX + ".signals.stale")
                .description("Number of media signals discarded for superseded bundles")
                .tag("signal", signal)
                .register(registry)
                .increment();
    }

    public void recordIgnoredChoice() {
        Counter.builder(METRIC_PREFIX + ".choices.ignored")
                .description("Number of choices received while no choice was pending")
                .register(registry)
                .increment();
    }

    public void recordChoice(Choice choice) {
        Counter.builder(METRIC_PREFIX + ".choices.accepted")
                .description("Number of accepted operator choices")
                .tag("choice", tagValue(choice.name()))
                .register(registry)
                .increment();
    }

    /**
     * Adds the number of malformed caption blocks dropped while loading one document.
     */
    public void recordDroppedCaptionBlocks(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".captions.dropped-blocks")
                .description("Number of malformed caption blocks dropped")
                .register(registry)
                .increment(count);
    }

    public void recordSequenceCompleted() {
        Counter.builder(METRIC_PREFIX + ".sequence.completed")
                .description("Number of sequences played to the end")
                .register(registry)
                .increment();
    }

    private static String tagValue(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}
