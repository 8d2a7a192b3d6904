package com.phillippitts.branchplayer.service.subtitle;

/**
 * Read-only view of the authoritative playback position.
 */
public interface PlaybackClock {

    /** Position in seconds. Advances monotonically except on seek. */
    double currentTime();

    /** Whether the clock refers to media that is ready; captions are not driven before that. */
    boolean isReady();
}
