package com.phillippitts.branchplayer.service.backend;

import com.phillippitts.branchplayer.service.subtitle.CaptionDisplay;
import com.phillippitts.branchplayer.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Log-only caption surface for headless runs. */
public class LoggingCaptionDisplay implements CaptionDisplay {
    private static final Logger LOG = LogManager.getLogger(LoggingCaptionDisplay.class);

    private static final int PREVIEW_CHARS = 120;

    @Override
    public void setText(String text) {
        if (text == null || text.isEmpty()) {
            LOG.debug("Caption cleared");
            return;
        }
        LOG.info("Caption: '{}'", LogSanitizer.preview(text, PREVIEW_CHARS));
    }
}
