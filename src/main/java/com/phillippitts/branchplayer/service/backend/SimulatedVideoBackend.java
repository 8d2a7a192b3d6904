package com.phillippitts.branchplayer.service.backend;

import com.phillippitts.branchplayer.service.playback.VideoBackend;
import com.phillippitts.branchplayer.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Headless video backend: every clip "plays" for a fixed duration on the wall clock.
 *
 * <p>Lets the flow run end-to-end without a decoder, e.g. for smoke tests and demos driven through
 * the REST API. Completions arrive on {@link CompletableFuture#delayedExecutor} threads.
 */
public class SimulatedVideoBackend implements VideoBackend {

    private static final Logger LOG = LogManager.getLogger(SimulatedVideoBackend.class);

    private final double clipDurationSeconds;
    private final long prepareDelayMs;

    private String clip;
    private boolean prepared;
    private boolean playing;
    private long playStartNanos;
    private double stoppedAt;
    private CompletableFuture<Void> pendingPrepare;
    private CompletableFuture<Void> endOfClip;

    public SimulatedVideoBackend(double clipDurationSeconds, long prepareDelayMs) {
        if (clipDurationSeconds <= 0) {
            throw new IllegalArgumentException("clipDurationSeconds must be > 0, got " + clipDurationSeconds);
        }
        this.clipDurationSeconds = clipDurationSeconds;
        this.prepareDelayMs = Math.max(0L, prepareDelayMs);
    }

    @Override
    public synchronized void setClip(String reference) {
        clip = reference;
        prepared = false;
        stoppedAt = 0.0;
    }

    @Override
    public synchronized CompletableFuture<Void> prepare() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        pendingPrepare = future;
        String preparing = clip;
        after(prepareDelayMs).execute(() -> {
            synchronized (this) {
                if (pendingPrepare == future) {
                    prepared = true;
                }
            }
            LOG.debug("Prepared clip {}", preparing);
            future.complete(null);
        });
        return future;
    }

    @Override
    public synchronized boolean isPrepared() {
        return prepared;
    }

    @Override
    public synchronized CompletableFuture<Void> play() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        endOfClip = future;
        playing = true;
        playStartNanos = System.nanoTime();
        after(TimeUtils.secondsToMillis(clipDurationSeconds)).execute(() -> {
            synchronized (this) {
                if (endOfClip != future || !playing) {
                    return;
                }
                playing = false;
                stoppedAt = clipDurationSeconds;
            }
            future.complete(null);
        });
        return future;
    }

    @Override
    public synchronized void stop() {
        if (playing) {
            stoppedAt = position();
        }
        playing = false;
        prepared = false;
        pendingPrepare = null;
        if (endOfClip != null) {
            endOfClip.cancel(false);
            endOfClip = null;
        }
    }

    @Override
    public synchronized boolean isPlaying() {
        return playing;
    }

    @Override
    public synchronized double currentTime() {
        return playing ? position() : stoppedAt;
    }

    private double position() {
        return Math.min(TimeUtils.elapsedSeconds(playStartNanos), clipDurationSeconds);
    }

    private static Executor after(long millis) {
        return CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS);
    }
}
