package com.phillippitts.branchplayer.service.caption;

import com.phillippitts.branchplayer.domain.Cue;

import java.util.List;

/**
 * Outcome of parsing one caption document.
 *
 * @param cues parsed cues, sorted ascending by start, unmodifiable
 * @param droppedBlocks number of blocks rejected as malformed
 */
public record CaptionParseResult(List<Cue> cues, int droppedBlocks) {

    public static final CaptionParseResult EMPTY = new CaptionParseResult(List.of(), 0);

    public CaptionParseResult {
        cues = cues == null ? List.of() : List.copyOf(cues);
    }
}
