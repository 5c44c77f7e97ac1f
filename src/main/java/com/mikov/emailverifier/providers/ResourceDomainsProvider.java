package com.mikov.emailverifier.providers;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads a list bundled on the classpath.
 */
@Slf4j
public class ResourceDomainsProvider extends LineFeedDomainsProvider {
    private final String resourcePath;

    public ResourceDomainsProvider(final String resourcePath) {
        if (ResourceDomainsProvider.class.getResource(resourcePath) == null) {
            throw new IllegalArgumentException(resourcePath + " resource does not exist");
        }
        this.resourcePath = resourcePath;
    }

    @Override
    protected String obtainData() {
        log.debug("Loading entries from resource {}", resourcePath);
        try (InputStream is = ResourceDomainsProvider.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException(resourcePath + " resource disappeared");
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read resource " + resourcePath, e);
        }
    }

    @Override
    public String getDescription() {
        return "classpath:" + resourcePath;
    }
}
