package com.phillippitts.branchplayer.domain;

import java.util.Objects;

/**
 * One timed caption entry. Times are in seconds.
 */
public record Cue(double start, double end, String text) {

    public Cue {
        Objects.requireNonNull(text, "text must not be null");
        if (end < start) {
            throw new IllegalArgumentException("Cue end (" + end + ") precedes start (" + start + ")");
        }
    }

    /** Inclusive on both bounds. */
    public boolean contains(double t) {
        return t >= start && t <= end;
    }
}
