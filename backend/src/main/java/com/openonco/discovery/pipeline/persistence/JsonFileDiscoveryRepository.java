package com.openonco.discovery.pipeline.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.model.Discovery;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Repository
public class JsonFileDiscoveryRepository implements DiscoveryRepository {
    private static final TypeReference<List<Discovery>> TYPE = new TypeReference<>() {
    };

    private final JsonFileStore store;
    private final Path file;

    public JsonFileDiscoveryRepository(JsonFileStore store, PipelineProperties properties) {
        this.store = store;
        this.file = Path.of(properties.getData().getDir(), "discoveries.json");
    }

    @Override
    public List<Discovery> findAll() {
        return new ArrayList<>(store.read(file, TYPE, List::of));
    }

    @Override
    public void saveAll(List<Discovery> discoveries) {
        store.writeAtomically(file, discoveries);
    }

    public Path file() {
        return file;
    }
}
