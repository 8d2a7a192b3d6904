package com.phillippitts.branchplayer.testutil;

import com.phillippitts.branchplayer.service.playback.AudioBackend;

/**
 * Test double for AudioBackend that only records calls.
 */
public class FakeAudioBackend implements AudioBackend {
    public String clip;
    public boolean playing;
    public double time;
    public int playCount;
    public int stopCount;

    @Override
    public void setClip(String reference) {
        clip = reference;
        playing = false;
    }

    @Override
    public boolean hasClip() {
        return clip != null;
    }

    @Override
    public void play() {
        playCount++;
        playing = true;
    }

    @Override
    public void stop() {
        stopCount++;
        playing = false;
    }

    @Override
    public void setTime(double seconds) {
        time = seconds;
    }

    @Override
    public double currentTime() {
        return time;
    }

    @Override
    public boolean isPlaying() {
        return playing;
    }
}
