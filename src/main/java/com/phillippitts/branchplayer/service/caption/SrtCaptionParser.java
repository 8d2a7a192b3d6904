package com.phillippitts.branchplayer.service.caption;

import com.phillippitts.branchplayer.domain.Cue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for SRT-style caption documents.
 *
 * <p>Block grammar:
 * <pre>
 * [index]
 * HH:MM:SS,mmm --&gt; HH:MM:SS,mmm
 * text line
 * [more text lines]
 * (blank line or end of document)
 * </pre>
 *
 * <p>Line endings are normalized to {@code \n} and a leading byte-order mark is stripped before
 * scanning. Blocks that lack a timing line or text, or whose end precedes their start, are
 * dropped. Output is sorted by start time regardless of document order; the sort is stable, so
 * cues sharing a start keep their document order.
 *
 * <p>Stateless and thread-safe.
 */
public class SrtCaptionParser implements CaptionParser {

    private static final Logger LOG = LogManager.getLogger(SrtCaptionParser.class);

    private static final char BOM = '\uFEFF';

    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n[ \\t]*\\n");

    private static final Pattern INDEX_LINE = Pattern.compile("\\d+");

    private static final Pattern TIMING_LINE = Pattern.compile(
            "(\\d{2}):(\\d{2}):(\\d{2}),(\\d{3})\\s*-->\\s*(\\d{2}):(\\d{2}):(\\d{2}),(\\d{3})");

    @Override
    public CaptionParseResult parseDetailed(String document) {
        if (document == null || document.isBlank()) {
            return CaptionParseResult.EMPTY;
        }

        String body = normalize(document);
        List<Cue> cues = new ArrayList<>();
        int dropped = 0;

        for (String block : BLOCK_SEPARATOR.split(body)) {
            if (block.isBlank()) {
                continue;
            }
            Cue cue = parseBlock(block);
            if (cue == null) {
                dropped++;
            } else {
                cues.add(cue);
            }
        }

        cues.sort(Comparator.comparingDouble(Cue::start));

        if (cues.isEmpty()) {
            LOG.warn("Caption document produced no cues ({} block(s) dropped)", dropped);
        } else if (dropped > 0) {
            LOG.debug("Parsed {} cue(s), dropped {} malformed block(s)", cues.size(), dropped);
        }
        return new CaptionParseResult(cues, dropped);
    }

    static String normalize(String document) {
        String body = document.replace("\r\n", "\n").replace('\r', '\n');
        if (!body.isEmpty() && body.charAt(0) == BOM) {
            body = body.substring(1);
        }
        return body;
    }

    /**
     * @return the parsed cue, or {@code null} if the block is malformed
     */
    private static Cue parseBlock(String block) {
        String[] lines = block.split("\n", -1);
        int i = 0;
        while (i < lines.length && lines[i].isBlank()) {
            i++;
        }
        if (i >= lines.length) {
            return null;
        }

        // Optional numeric index line, only when a timing line follows it
        if (INDEX_LINE.matcher(lines[i].trim()).matches() && i + 1 < lines.length
                && TIMING_LINE.matcher(lines[i + 1].trim()).matches()) {
            i++;
        }

        Matcher timing = TIMING_LINE.matcher(lines[i].trim());
        if (!timing.matches()) {
            LOG.debug("Dropping caption block without a timing line: '{}'", lines[i].trim());
            return null;
        }

        double start = toSeconds(timing, 1);
        double end = toSeconds(timing, 5);
        if (end < start) {
            LOG.debug("Dropping caption block with end {} before start {}", end, start);
            return null;
        }

        StringBuilder text = new StringBuilder();
        for (int j = i + 1; j < lines.length; j++) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(lines[j]);
        }
        String trimmed = text.toString().trim();
        if (trimmed.isEmpty()) {
            LOG.debug("Dropping caption block at {}s without text", start);
            return null;
        }
        return new Cue(start, end, trimmed);
    }

    private static double toSeconds(Matcher m, int firstGroup) {
        int h = Integer.parseInt(m.group(firstGroup));
        int min = Integer.parseInt(m.group(firstGroup + 1));
        int s = Integer.parseInt(m.group(firstGroup + 2));
        int ms = Integer.parseInt(m.group(firstGroup + 3));
        return h * 3600 + min * 60 + s + ms / 1000.0;
    }
}
