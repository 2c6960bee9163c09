package com.convoflow.editor;

import com.convoflow.config.EditorConfig;
import com.convoflow.schema.FlowJson;
import com.convoflow.schema.model.FlowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Single-file cache of the document currently being edited. Used as the load fallback when the
 * remote source has nothing and as the autosave target.
 */
public final class LocalDocumentCache {

    private static final Logger log = LoggerFactory.getLogger(LocalDocumentCache.class);

    private final Path file;

    public LocalDocumentCache(Path file) {
        this.file = file;
    }

    public static LocalDocumentCache fromConfig(EditorConfig config) {
        return new LocalDocumentCache(config.getCachePath());
    }

    public Path getFile() {
        return file;
    }

    /** Raw JSON of the cached document, empty when there is no readable cache file. */
    public Optional<String> read() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read cached document {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replaces the cached document.
     *
     * @throws UncheckedIOException when the file cannot be written
     */
    public void write(FlowDocument document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, FlowJson.toJson(document));
            log.debug("Cached document {} to {}", document.getDocumentId(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cached document " + file, e);
        }
    }

    public boolean clear() {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete cached document " + file, e);
        }
    }
}
