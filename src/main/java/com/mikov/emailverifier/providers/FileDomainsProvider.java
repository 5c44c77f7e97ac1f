package com.mikov.emailverifier.providers;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a list from the local filesystem, re-reading the file on every load.
 */
@Slf4j
public class FileDomainsProvider extends LineFeedDomainsProvider {
    private final Path file;

    public FileDomainsProvider(final Path file) {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException(file + " does not exist");
        }
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException(file + " must be a regular file");
        }
        this.file = file;
    }

    @Override
    protected String obtainData() {
        log.debug("Loading entries from file {}", file);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    @Override
    public String getDescription() {
        return file.toString();
    }
}
