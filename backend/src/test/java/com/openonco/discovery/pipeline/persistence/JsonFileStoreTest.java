package com.openonco.discovery.pipeline.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openonco.discovery.config.PipelineConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileStoreTest {
    private static final TypeReference<Map<String, Integer>> TYPE = new TypeReference<>() {
    };

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new PipelineConfig().objectMapper();
    private final JsonFileStore store = new JsonFileStore(objectMapper);

    @Test
    void missingFileReadsAsFallback() {
        Map<String, Integer> value = store.read(tempDir.resolve("absent.json"), TYPE, Map::of);
        assertThat(value).isEmpty();
    }

    @Test
    void writeReplacesTargetAndLeavesNoTempFile() throws Exception {
        Path file = tempDir.resolve("nested/state.json");
        store.writeAtomically(file, Map.of("a", 1));
        store.writeAtomically(file, Map.of("a", 2));

        assertThat(store.read(file, TYPE, Map::of)).containsEntry("a", 2);
        try (var listing = Files.list(file.getParent())) {
            assertThat(listing.map(path -> path.getFileName().toString()).toList()).containsExactly("state.json");
        }
    }

    @Test
    void corruptFileRaisesPersistenceException() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");
        assertThatThrownBy(() -> store.read(file, TYPE, Map::of))
            .isInstanceOf(PersistenceException.class)
            .hasMessageContaining("broken.json");
    }

    @Test
    void failedWriteKeepsPreviousDocument() throws Exception {
        Path file = tempDir.resolve("state.json");
        store.writeAtomically(file, List.of("kept"));

        Object unserializable = new Object();
        assertThatThrownBy(() -> store.writeAtomically(file, Map.of("value", unserializable)))
            .isInstanceOf(PersistenceException.class);
        assertThat(Files.readString(file)).contains("kept");
        assertThat(Files.exists(tempDir.resolve("state.json.tmp"))).isFalse();
    }
}
