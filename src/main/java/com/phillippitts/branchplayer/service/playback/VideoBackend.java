package com.phillippitts.branchplayer.service.playback;

import java.util.concurrent.CompletableFuture;

/**
 * Transport controls of the external video decode-and-render backend.
 *
 * <p>Abstraction over the actual player so the playback session stays hermetic in tests.
 * Futures may complete on any thread.
 */
public interface VideoBackend {

    /** Assign the clip to play next. Resets prepared state. */
    void setClip(String reference);

    /**
     * Start preparing the assigned clip without blocking.
     *
     * @return future completing once the clip is ready to play
     */
    CompletableFuture<Void> prepare();

    /** Whether the assigned clip finished preparing. */
    boolean isPrepared();

    /**
     * Start playback from the beginning of the prepared clip.
     *
     * @return future completing when playback reaches the end of the clip; a stopped clip may
     *         never complete it or complete it exceptionally
     */
    CompletableFuture<Void> play();

    void stop();

    boolean isPlaying();

    /** Playback position in seconds. */
    double currentTime();
}
