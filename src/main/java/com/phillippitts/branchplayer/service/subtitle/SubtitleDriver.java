package com.phillippitts.branchplayer.service.subtitle;

import com.phillippitts.branchplayer.domain.Cue;
import com.phillippitts.branchplayer.service.caption.CueLookup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Maps the playback clock to caption text once per tick.
 *
 * <p>Each tick reads the clock, applies the configured offset and looks up the active cue. The
 * display is only written when the text actually changes. The cue list and the last cue index
 * are owned by this driver and replaced wholesale by {@link #load(List)}.
 *
 * <p>Not thread-safe: must be used from the tick thread only. {@link #displayedText()} may be
 * read from any thread.
 */
public class SubtitleDriver {

    private static final Logger LOG = LogManager.getLogger(SubtitleDriver.class);

    private final CaptionDisplay display;
    private final PlaybackClock clock;
    private final double offsetSeconds;
    private final boolean clearInGaps;

    private List<Cue> cues = List.of();
    private int lastCueIndex = CueLookup.NONE;
    // false when lastCueIndex is only the "already passed" marker from lastStartAtOrBefore
    private boolean lastCueShown;
    private volatile String shownText = "";

    /**
     * @param display caption surface
     * @param clock authoritative playback clock
     * @param offsetSeconds signed shift added to the clock (negative compensates backend latency)
     * @param clearInGaps clear the display when playback is between cues
     */
    public SubtitleDriver(CaptionDisplay display, PlaybackClock clock, double offsetSeconds, boolean clearInGaps) {
        this.display = Objects.requireNonNull(display, "display must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.offsetSeconds = offsetSeconds;
        this.clearInGaps = clearInGaps;
    }

    /**
     * Replaces the cue list and clears the display.
     *
     * @param newCues cues sorted ascending by start; {@code null} means none
     */
    public void load(List<Cue> newCues) {
        cues = newCues == null ? List.of() : List.copyOf(newCues);
        lastCueIndex = CueLookup.NONE;
        lastCueShown = false;
        show("");
        LOG.debug("Loaded {} cue(s)", cues.size());
    }

    /** Drops all cues and clears the display. */
    public void clear() {
        load(List.of());
    }

    /**
     * Per-tick update.
     */
    public void tick() {
        if (cues.isEmpty()) {
            show("");
            return;
        }
        if (!clock.isReady()) {
            return;
        }

        double t = clock.currentTime() + offsetSeconds;
        if (Double.isNaN(t)) {
            return;
        }

        if (lastCueIndex >= 0 && lastCueIndex < cues.size()) {
            if (lastCueShown && cues.get(lastCueIndex).contains(t)) {
                return;
            }
            // Left the cue: clear before searching so stale text never shows in a gap
            if (clearInGaps) {
                show("");
            }
        }

        int idx = CueLookup.locate(cues, t);
        if (idx != CueLookup.NONE) {
            lastCueIndex = idx;
            lastCueShown = true;
            show(cues.get(idx).text());
        } else {
            lastCueIndex = CueLookup.lastStartAtOrBefore(cues, t);
            lastCueShown = false;
            if (clearInGaps) {
                show("");
            }
        }
    }

    /** Text currently on the display. */
    public String displayedText() {
        return shownText;
    }

    public int cueCount() {
        return cues.size();
    }

    private void show(String text) {
        if (!text.equals(shownText)) {
            shownText = text;
            display.setText(text);
        }
    }
}
