package com.phillippitts.branchplayer.service.playback;

/**
 * Transport controls of one external audio track (narration or music).
 */
public interface AudioBackend {

    /** Assign a clip, or {@code null} for "no clip". */
    void setClip(String reference);

    boolean hasClip();

    void play();

    void stop();

    /** Seek to the given position in seconds. */
    void setTime(double seconds);

    double currentTime();

    boolean isPlaying();
}
