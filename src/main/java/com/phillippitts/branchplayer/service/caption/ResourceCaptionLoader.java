package com.phillippitts.branchplayer.service.caption;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads caption documents through Spring's {@link ResourceLoader}, so references may use
 * {@code classpath:}, {@code file:} or plain paths.
 *
 * <p>A missing or unreadable document is logged and treated as "no captions" for the bundle.
 */
public class ResourceCaptionLoader implements CaptionLoader {

    private static final Logger LOG = LogManager.getLogger(ResourceCaptionLoader.class);

    private final ResourceLoader resourceLoader;

    public ResourceCaptionLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader must not be null");
    }

    @Override
    public Optional<String> load(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        Resource resource = resourceLoader.getResource(reference);
        if (!resource.exists()) {
            LOG.warn("Caption document not found: {}", reference);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.warn("Failed to read caption document {}: {}", reference, e.toString());
            return Optional.empty();
        }
    }
}
