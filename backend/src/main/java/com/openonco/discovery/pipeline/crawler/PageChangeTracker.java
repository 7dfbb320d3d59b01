package com.openonco.discovery.pipeline.crawler;

import com.openonco.discovery.pipeline.model.PageSnapshot;
import com.openonco.discovery.pipeline.persistence.PageSnapshotRepository;
import com.openonco.discovery.pipeline.util.HashUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects changes on monitored pages by content hash. The first observation of a page only takes
 * a snapshot; later observations report the items that were not on the previous snapshot.
 * New snapshots are staged and reach storage only through {@link #commit(String)}.
 */
@Component
public class PageChangeTracker {
    private final PageSnapshotRepository repository;
    private final Clock clock;
    private final Map<String, PageSnapshot> staged = new ConcurrentHashMap<>();

    public PageChangeTracker(PageSnapshotRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public PageChange observe(String key, String content, List<String> items) {
        String hash = HashUtils.sha256Hex(content);
        PageSnapshot previous = repository.find(key);
        if (previous != null && hash.equals(previous.hash())) {
            return PageChange.unchanged(hash);
        }
        staged.put(key, new PageSnapshot(hash, items, clock.instant()));
        if (previous == null) {
            return PageChange.captured(hash);
        }
        Set<String> known = new HashSet<>(previous.items());
        List<String> newItems = items.stream()
            .filter(item -> !known.contains(item))
            .toList();
        return new PageChange(hash, false, true, newItems);
    }

    /**
     * Writes the staged snapshots whose key starts with {@code keyPrefix} in one go.
     */
    public void commit(String keyPrefix) {
        Map<String, PageSnapshot> batch = take(keyPrefix);
        if (!batch.isEmpty()) {
            repository.saveAll(batch);
        }
    }

    public void discard(String keyPrefix) {
        take(keyPrefix);
    }

    private Map<String, PageSnapshot> take(String keyPrefix) {
        Map<String, PageSnapshot> batch = new LinkedHashMap<>();
        for (String key : List.copyOf(staged.keySet())) {
            if (key.startsWith(keyPrefix)) {
                PageSnapshot snapshot = staged.remove(key);
                if (snapshot != null) {
                    batch.put(key, snapshot);
                }
            }
        }
        return batch;
    }
}
