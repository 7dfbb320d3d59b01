package com.openonco.discovery.pipeline.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * Reads and writes JSON documents on disk. Writes go to a sibling {@code .tmp} file that is then
 * moved over the target, so readers only ever see the previous or the new document.
 * Assumes a single writing process.
 */
@Component
public class JsonFileStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final ObjectMapper objectMapper;

    public JsonFileStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> T read(Path file, TypeReference<T> type, Supplier<T> fallback) {
        if (!Files.exists(file)) {
            return fallback.get();
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            return value == null ? fallback.get() : value;
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file, e);
        }
    }

    public void writeAtomically(Path file, Object value) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
            move(tmp, file);
        } catch (IOException e) {
            discardTemp(tmp);
            throw new PersistenceException("Failed to write " + file, e);
        }
    }

    private void move(Path tmp, Path file) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discardTemp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}", tmp, e);
        }
    }
}
