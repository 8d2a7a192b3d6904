package com.phillippitts.branchplayer.service.playback;

import com.phillippitts.branchplayer.domain.MediaBundle;
import com.phillippitts.branchplayer.exception.FlowConfigurationException;
import com.phillippitts.branchplayer.service.caption.CaptionLoader;
import com.phillippitts.branchplayer.service.caption.CaptionParseResult;
import com.phillippitts.branchplayer.service.caption.CaptionParser;
import com.phillippitts.branchplayer.service.metrics.PlaybackMetrics;
import com.phillippitts.branchplayer.service.playback.event.BundleFinishedEvent;
import com.phillippitts.branchplayer.service.signal.FlowSignal;
import com.phillippitts.branchplayer.service.signal.SignalQueue;
import com.phillippitts.branchplayer.service.subtitle.SubtitleDriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Plays one media bundle across the video, narration and music tracks.
 *
 * <p><b>Protocol:</b>
 * <ol>
 *   <li>{@link #load(MediaBundle)} stops the previous bundle, assigns the audio clips, hands the
 *       video to the backend, requests {@code prepare()} and loads the bundle's captions</li>
 *   <li>when the backend is prepared, {@link #onPrepared(UUID)} starts video, narration and
 *       music within the same call</li>
 *   <li>when the video reaches its end, {@link #onFinished(UUID)} notifies finished-listeners
 *       and returns to idle</li>
 * </ol>
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → PREPARING (via load)
 * PREPARING → PLAYING (via onPrepared)
 * PLAYING → IDLE (via onFinished or stop)
 * </pre>
 *
 * <p>Backend completions never touch state directly: they post a {@link FlowSignal} tagged with
 * the bundle id to the {@link SignalQueue}. Signals whose id is not the active bundle are stale
 * and discarded.
 *
 * <p><b>Thread Safety:</b> not thread-safe; all methods except the backend callbacks run on the
 * tick thread.
 *
 * @since 1.0
 */
public class PlaybackSession {

    private static final Logger LOG = LogManager.getLogger(PlaybackSession.class);

    public enum State { IDLE, PREPARING, PLAYING }

    private final VideoBackend video;
    private final AudioBackend narration;
    private final AudioBackend music;
    private final SubtitleDriver subtitles;
    private final CaptionLoader captionLoader;
    private final CaptionParser captionParser;
    private final SignalQueue signals;
    private final PlaybackMetrics metrics;
    private final List<Consumer<BundleFinishedEvent>> finishedListeners = new CopyOnWriteArrayList<>();

    private State state = State.IDLE;
    private UUID activeBundleId;
    private MediaBundle activeBundle;

    public PlaybackSession(VideoBackend video,
                           AudioBackend narration,
                           AudioBackend music,
                           SubtitleDriver subtitles,
                           CaptionLoader captionLoader,
                           CaptionParser captionParser,
                           SignalQueue signals,
                           PlaybackMetrics metrics) {
        this.video = Objects.requireNonNull(video, "video must not be null");
        this.narration = Objects.requireNonNull(narration, "narration must not be null");
        this.music = Objects.requireNonNull(music, "music must not be null");
        this.subtitles = Objects.requireNonNull(subtitles, "subtitles must not be null");
        this.captionLoader = Objects.requireNonNull(captionLoader, "captionLoader must not be null");
        this.captionParser = Objects.requireNonNull(captionParser, "captionParser must not be null");
        this.signals = Objects.requireNonNull(signals, "signals must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Subscribe to end-of-bundle notifications.
     */
    public void addFinishedListener(Consumer<BundleFinishedEvent> listener) {
        finishedListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Loads a bundle, superseding whatever was playing.
     *
     * @param bundle bundle to play
     * @return id tagging this bundle's prepared/finished signals
     * @throws FlowConfigurationException if the bundle has no video; nothing is stopped in that case
     */
    public UUID load(MediaBundle bundle) {
        Objects.requireNonNull(bundle, "bundle must not be null");
        if (bundle.video() == null) {
            throw new FlowConfigurationException("Missing video for " + bundle.describe());
        }

        stop();

        narration.setClip(bundle.narration());
        music.setClip(bundle.music());
        narration.setTime(0.0);
        music.setTime(0.0);
        logSkippedTracks(bundle);

        video.setClip(bundle.video());

        UUID bundleId = UUID.randomUUID();
        activeBundleId = bundleId;
        activeBundle = bundle;
        state = State.PREPARING;
        metrics.recordBundleStarted(bundle.phase());
        LOG.info("Loading bundle {} (bundle={}, video={})", bundle.describe(), bundleId, bundle.video());

        video.prepare().whenComplete((ignored, error) -> {
            if (error != null) {
                LOG.warn("Video prepare failed for bundle {}: {}", bundleId, error.toString());
                return;
            }
            signals.post(new FlowSignal.MediaPrepared(bundleId));
        });

        loadCaptions(bundle);
        return bundleId;
    }

    /**
     * Starts all tracks of the active bundle once its video is prepared.
     *
     * @return {@code true} if playback started, {@code false} for a stale signal
     */
    public boolean onPrepared(UUID bundleId) {
        if (!isActive(bundleId, State.PREPARING)) {
            LOG.debug("Discarding stale prepared signal for bundle {} (active={}, state={})",
                    bundleId, activeBundleId, state);
            metrics.recordStaleSignal("prepared");
            return false;
        }

        if (narration.hasClip()) {
            narration.setTime(0.0);
        }
        if (music.hasClip()) {
            music.setTime(0.0);
        }

        CompletableFuture<Void> endOfClip = video.play();
        if (narration.hasClip()) {
            narration.play();
        }
        if (music.hasClip()) {
            music.play();
        }
        state = State.PLAYING;
        LOG.debug("Started playback of bundle {} ({})", bundleId, activeBundle.describe());

        endOfClip.whenComplete((ignored, error) -> {
            if (error != null) {
                LOG.debug("Bundle {} ended without reaching end of clip: {}", bundleId, error.toString());
                return;
            }
            signals.post(new FlowSignal.MediaFinished(bundleId));
        });
        return true;
    }

    /**
     * Completes the active bundle and notifies listeners.
     *
     * @return {@code true} if listeners were notified, {@code false} for a stale signal
     */
    public boolean onFinished(UUID bundleId) {
        if (!isActive(bundleId, State.PLAYING)) {
            LOG.debug("Discarding stale finished signal for bundle {} (active={}, state={})",
                    bundleId, activeBundleId, state);
            metrics.recordStaleSignal("finished");
            return false;
        }

        state = State.IDLE;
        MediaBundle finished = activeBundle;
        LOG.info("Bundle {} finished (bundle={})", finished.describe(), bundleId);

        BundleFinishedEvent event = new BundleFinishedEvent(
                bundleId, finished.phase(), finished.questionIndex(), Instant.now());
        for (Consumer<BundleFinishedEvent> listener : finishedListeners) {
            listener.accept(event);
        }
        return true;
    }

    /**
     * Stops all tracks and forgets the active bundle; its late signals become stale.
     */
    public void stop() {
        video.stop();
        if (narration.isPlaying()) {
            narration.stop();
        }
        if (music.isPlaying()) {
            music.stop();
        }
        subtitles.clear();
        if (activeBundleId != null && state != State.IDLE) {
            LOG.debug("Stopped bundle {} in state {}", activeBundleId, state);
        }
        activeBundleId = null;
        activeBundle = null;
        state = State.IDLE;
    }

    public State state() {
        return state;
    }

    /** @return id of the bundle being prepared or played, or {@code null} */
    public UUID activeBundleId() {
        return activeBundleId;
    }

    private boolean isActive(UUID bundleId, State expected) {
        return bundleId != null && bundleId.equals(activeBundleId) && state == expected;
    }

    private void loadCaptions(MediaBundle bundle) {
        if (bundle.captions() == null) {
            subtitles.clear();
            return;
        }
        CaptionParseResult result = captionLoader.load(bundle.captions())
                .map(captionParser::parseDetailed)
                .orElse(CaptionParseResult.EMPTY);
        metrics.recordDroppedCaptionBlocks(result.droppedBlocks());
        subtitles.load(result.cues());
    }

    private static void logSkippedTracks(MediaBundle bundle) {
        if (bundle.narration() == null) {
            LOG.debug("No narration for {}; track stays silent", bundle.describe());
        }
        if (bundle.music() == null) {
            LOG.debug("No music for {}; track stays silent", bundle.describe());
        }
        if (bundle.captions() == null) {
            LOG.debug("No captions for {}", bundle.describe());
        }
    }
}
