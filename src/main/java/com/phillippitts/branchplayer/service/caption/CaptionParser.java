package com.phillippitts.branchplayer.service.caption;

import com.phillippitts.branchplayer.domain.Cue;

import java.util.List;

/**
 * Converts a time-coded caption document into an ordered list of cues.
 *
 * <p>Implementations never throw on bad input: malformed blocks are dropped and the rest of the
 * document still parses.
 */
public interface CaptionParser {

    /**
     * Parses a document and reports how many blocks were dropped.
     *
     * @param document raw caption text, may be {@code null}
     * @return parse result; never {@code null}
     */
    CaptionParseResult parseDetailed(String document);

    /**
     * @param document raw caption text, may be {@code null}
     * @return cues sorted ascending by start; empty when nothing parses
     */
    default List<Cue> parse(String document) {
        return parseDetailed(document).cues();
    }
}
