package com.phillippitts.branchplayer.testutil;

import com.phillippitts.branchplayer.service.caption.CaptionLoader;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * CaptionLoader serving documents from memory.
 */
public class MapCaptionLoader implements CaptionLoader {
    private final Map<String, String> documents = new HashMap<>();

    public MapCaptionLoader with(String reference, String document) {
        documents.put(reference, document);
        return this;
    }

    @Override
    public Optional<String> load(String reference) {
        return Optional.ofNullable(documents.get(reference));
    }
}
