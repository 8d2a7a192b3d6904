package com.phillippitts.branchplayer.domain;

/**
 * Media references for one phase of one question.
 *
 * <p>Only {@code video} can be required; a {@code null} narration, music or captions reference
 * means that track stays silent for the phase.
 *
 * @param video video clip reference (may be {@code null} for an unconfigured outcome)
 * @param narration narration audio reference, or {@code null}
 * @param music background music reference, or {@code null}
 * @param captions caption document reference, or {@code null}
 */
public record PhaseMedia(String video, String narration, String music, String captions) {

    public static final PhaseMedia EMPTY = new PhaseMedia(null, null, null, null);

    public PhaseMedia {
        video = blankToNull(video);
        narration = blankToNull(narration);
        music = blankToNull(music);
        captions = blankToNull(captions);
    }

    public static PhaseMedia ofVideo(String video) {
        return new PhaseMedia(video, null, null, null);
    }

    public boolean hasVideo() {
        return video != null;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
