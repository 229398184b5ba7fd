package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * On-disk copy of the last successfully fetched HTML per URL, under {@code scraped-data/cache} by default.
 */
public class PageCache {
    private static final Logger logger = LoggerFactory.getLogger(PageCache.class);

    private final Path directory;

    public PageCache(Path directory) {
        this.directory = directory;
    }

    public Optional<String> read(String url) {
        Path file = fileFor(url);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cached page " + file, e);
        }
    }

    /**
     * Stores a page. A failed write is logged and the run goes on with the fresh copy in memory.
     */
    public void write(String url, String html) {
        Path file = fileFor(url);
        try {
            Files.createDirectories(directory);
            Files.writeString(file, html, StandardCharsets.UTF_8);
            logger.debug("Cached {} at {}", url, file);
        } catch (IOException e) {
            logger.warn("Failed to cache {} at {}: {}", url, file, e.getMessage());
        }
    }

    Path fileFor(String url) {
        String name = Utils.sanitizeFilename(url.replaceFirst("^https?://", ""));
        return directory.resolve(name + ".html");
    }
}
