package com.phillippitts.branchplayer.domain;

import java.util.Objects;

/**
 * Everything the playback session needs for one moment of the narrative.
 *
 * <p>Passive value; selected by the flow state machine and handed to the playback session.
 *
 * @param phase phase this bundle plays
 * @param questionIndex zero-based index of the question set it came from
 * @param media video, narration, music and caption references
 */
public record MediaBundle(Phase phase, int questionIndex, PhaseMedia media) {

    public MediaBundle {
        Objects.requireNonNull(phase, "phase must not be null");
        media = media == null ? PhaseMedia.EMPTY : media;
        if (questionIndex < 0) {
            throw new IllegalArgumentException("questionIndex must be >= 0, got " + questionIndex);
        }
    }

    public String video() {
        return media.video();
    }

    public String narration() {
        return media.narration();
    }

    public String music() {
        return media.music();
    }

    public String captions() {
        return media.captions();
    }

    /** Short description for log lines. */
    public String describe() {
        return phase + "#" + questionIndex;
    }
}
