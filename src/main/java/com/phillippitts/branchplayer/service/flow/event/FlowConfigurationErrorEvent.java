package com.phillippitts.branchplayer.service.flow.event;

import java.time.Instant;

/**
 * Published when the flow cannot start or cannot load a bundle because of configuration.
 *
 * Payload contains a short reason and timestamp.
 */
public record FlowConfigurationErrorEvent(String reason, Instant at) { }
