package com.phillippitts.branchplayer.service.caption;

import java.util.Optional;

/**
 * Resolves a caption reference from configuration into document text.
 */
public interface CaptionLoader {

    /**
     * @param reference caption reference (e.g. {@code classpath:captions/q1.srt})
     * @return UTF-8 document text, or empty when the reference cannot be read
     */
    Optional<String> load(String reference);
}
