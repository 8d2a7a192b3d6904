package com.phillippitts.branchplayer.service.caption;

import com.phillippitts.branchplayer.domain.Cue;

import java.util.List;

/**
 * Binary-search queries over a cue list sorted ascending by start.
 *
 * <p>Pure functions of {@code (cues, t)}; they run on every scheduling tick, so both are
 * O(log n). Cues are assumed not to overlap. With overlapping input the result is whichever
 * containing cue the search reaches first.
 *
 * @since 1.0
 */
public final class CueLookup {

    /** Returned when no cue matches. */
    public static final int NONE = -1;

    private CueLookup() {
        // Utility class - prevent instantiation
    }

    /**
     * Finds the cue whose {@code [start, end]} interval contains {@code t}.
     *
     * @param cues cues sorted by start
     * @param t query time in seconds
     * @return index of the containing cue, or {@link #NONE}
     */
    public static int locate(List<Cue> cues, double t) {
        if (cues == null || Double.isNaN(t)) {
            return NONE;
        }
        int lo = 0;
        int hi = cues.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            Cue c = cues.get(mid);
            if (t < c.start()) {
                hi = mid - 1;
            } else if (t > c.end()) {
                lo = mid + 1;
            } else {
                return mid;
            }
        }
        return NONE;
    }

    /**
     * Finds the highest-indexed cue that starts at or before {@code t}.
     *
     * @param cues cues sorted by start
     * @param t query time in seconds
     * @return index of that cue, or {@link #NONE} if every cue starts after {@code t}
     */
    public static int lastStartAtOrBefore(List<Cue> cues, double t) {
        if (cues == null || Double.isNaN(t)) {
            return NONE;
        }
        int lo = 0;
        int hi = cues.size() - 1;
        int answer = NONE;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (cues.get(mid).start() <= t) {
                answer = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return answer;
    }
}
