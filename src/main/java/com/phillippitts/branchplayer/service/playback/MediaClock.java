package com.phillippitts.branchplayer.service.playback;

import com.phillippitts.branchplayer.service.subtitle.PlaybackClock;

import java.util.Objects;

/**
 * Caption clock backed by the media tracks.
 *
 * <p>While narration plays, its position is used since captions follow the spoken track;
 * otherwise the video position is used.
 */
public class MediaClock implements PlaybackClock {

    private final VideoBackend video;
    private final AudioBackend narration;

    public MediaClock(VideoBackend video, AudioBackend narration) {
        this.video = Objects.requireNonNull(video, "video must not be null");
        this.narration = Objects.requireNonNull(narration, "narration must not be null");
    }

    @Override
    public double currentTime() {
        if (narration.hasClip() && narration.isPlaying()) {
            return narration.currentTime();
        }
        return video.currentTime();
    }

    @Override
    public boolean isReady() {
        return video.isPrepared();
    }
}
