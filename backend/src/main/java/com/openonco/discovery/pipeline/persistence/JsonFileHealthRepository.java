package com.openonco.discovery.pipeline.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.model.HealthRecord;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Repository
public class JsonFileHealthRepository implements HealthRepository {
    private static final TypeReference<LinkedHashMap<String, HealthRecord>> TYPE = new TypeReference<>() {
    };

    private final JsonFileStore store;
    private final Path file;

    public JsonFileHealthRepository(JsonFileStore store, PipelineProperties properties) {
        this.store = store;
        this.file = Path.of(properties.getData().getDir(), "health.json");
    }

    @Override
    public Map<String, HealthRecord> findAll() {
        return new LinkedHashMap<>(store.read(file, TYPE, LinkedHashMap::new));
    }

    @Override
    public void saveAll(Map<String, HealthRecord> records) {
        store.writeAtomically(file, records);
    }
}
