package com.phillippitts.branchplayer.service.backend;

import com.phillippitts.branchplayer.service.playback.AudioBackend;
import com.phillippitts.branchplayer.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Headless audio track whose position follows the wall clock while playing.
 */
public class SimulatedAudioBackend implements AudioBackend {

    private static final Logger LOG = LogManager.getLogger(SimulatedAudioBackend.class);

    private final String trackName;

    private String clip;
    private boolean playing;
    private double basePosition;
    private long playStartNanos;

    public SimulatedAudioBackend(String trackName) {
        this.trackName = trackName;
    }

    @Override
    public synchronized void setClip(String reference) {
        clip = reference;
        playing = false;
        basePosition = 0.0;
    }

    @Override
    public synchronized boolean hasClip() {
        return clip != null;
    }

    @Override
    public synchronized void play() {
        if (clip == null) {
            return;
        }
        playing = true;
        playStartNanos = System.nanoTime();
        LOG.debug("{} track playing {}", trackName, clip);
    }

    @Override
    public synchronized void stop() {
        if (playing) {
            basePosition += TimeUtils.elapsedSeconds(playStartNanos);
        }
        playing = false;
    }

    @Override
    public synchronized void setTime(double seconds) {
        basePosition = Math.max(0.0, seconds);
        playStartNanos = System.nanoTime();
    }

    @Override
    public synchronized double currentTime() {
        return playing ? basePosition + TimeUtils.elapsedSeconds(playStartNanos) : basePosition;
    }

    @Override
    public synchronized boolean isPlaying() {
        return playing;
    }
}
