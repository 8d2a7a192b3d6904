package com.phillippitts.branchplayer.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the headless media backends.
 */
@Validated
@ConfigurationProperties(prefix = "backend.simulated")
public class SimulatedBackendProperties {

    /** How long every simulated clip plays, in seconds. */
    @DecimalMin("0.001")
    private final double clipDurationSeconds;

    /** Delay before a simulated prepare completes. */
    @Min(0)
    private final long prepareDelayMs;

    @ConstructorBinding
    public SimulatedBackendProperties(Double clipDurationSeconds, Long prepareDelayMs) {
        this.clipDurationSeconds = clipDurationSeconds == null ? 5.0 : clipDurationSeconds;
        this.prepareDelayMs = prepareDelayMs == null ? 50L : prepareDelayMs;
    }

    public double getClipDurationSeconds() {
        return clipDurationSeconds;
    }

    public long getPrepareDelayMs() {
        return prepareDelayMs;
    }
}
