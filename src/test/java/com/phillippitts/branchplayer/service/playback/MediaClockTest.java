package com.phillippitts.branchplayer.service.playback;

import com.phillippitts.branchplayer.testutil.FakeAudioBackend;
import com.phillippitts.branchplayer.testutil.FakeVideoBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MediaClockTest {

    private FakeVideoBackend video;
    private FakeAudioBackend narration;
    private MediaClock clock;

    @BeforeEach
    void setUp() {
        video = new FakeVideoBackend();
        narration = new FakeAudioBackend();
        clock = new MediaClock(video, narration);
        video.time = 4.0;
        narration.time = 3.9;
    }

    @Test
    void prefersNarrationWhilePlaying() {
        narration.setClip("n.mp3");
        narration.play();

        assertThat(clock.currentTime()).isEqualTo(3.9);
    }

    @Test
    void fallsBackToVideoWithoutNarration() {
        assertThat(clock.currentTime()).isEqualTo(4.0);
    }

    @Test
    void fallsBackToVideoWhenNarrationStopped() {
        narration.setClip("n.mp3");

        assertThat(clock.currentTime()).isEqualTo(4.0);
    }

    @Test
    void readyOnlyOnceVideoPrepared() {
        assertThat(clock.isReady()).isFalse();

        video.prepared = true;

        assertThat(clock.isReady()).isTrue();
    }
}
