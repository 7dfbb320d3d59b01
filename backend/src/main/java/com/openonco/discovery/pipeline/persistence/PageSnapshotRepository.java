package com.openonco.discovery.pipeline.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.model.PageSnapshot;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshots of monitored vendor and payer pages, keyed by {@code <source>:<page id>}.
 */
@Repository
public class PageSnapshotRepository {
    private static final TypeReference<LinkedHashMap<String, PageSnapshot>> TYPE = new TypeReference<>() {
    };

    private final JsonFileStore store;
    private final Path file;
    private final Object lock = new Object();

    public PageSnapshotRepository(JsonFileStore store, PipelineProperties properties) {
        this.store = store;
        this.file = Path.of(properties.getData().getDir(), "page-snapshots.json");
    }

    public PageSnapshot find(String key) {
        synchronized (lock) {
            return store.read(file, TYPE, LinkedHashMap::new).get(key);
        }
    }

    public void saveAll(Map<String, PageSnapshot> snapshots) {
        synchronized (lock) {
            Map<String, PageSnapshot> all = store.read(file, TYPE, LinkedHashMap::new);
            all.putAll(snapshots);
            store.writeAtomically(file, all);
        }
    }
}
