package com.phillippitts.branchplayer.service.playback.event;

import com.phillippitts.branchplayer.domain.Phase;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted by the playback session when the active bundle's video reaches its end.
 *
 * @param bundleId id assigned when the bundle was loaded
 * @param phase phase the bundle played
 * @param questionIndex question the bundle belongs to
 * @param at when the end of clip was processed
 */
public record BundleFinishedEvent(UUID bundleId, Phase phase, int questionIndex, Instant at) { }
