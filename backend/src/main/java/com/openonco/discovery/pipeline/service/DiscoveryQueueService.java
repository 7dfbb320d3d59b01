package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.pipeline.model.Discovery;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.QueueStatus;
import com.openonco.discovery.pipeline.persistence.DiscoveryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable review queue. A discovery with a url is unique per {@code (source, url)}; adding a
 * second one is a no-op that returns {@code null}. Mutations are serialized within this process.
 */
@Service
public class DiscoveryQueueService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryQueueService.class);

    private final DiscoveryRepository repository;
    private final CrawlerHealthService healthService;
    private final Clock clock;
    private final Object lock = new Object();

    public DiscoveryQueueService(DiscoveryRepository repository, CrawlerHealthService healthService, Clock clock) {
        this.repository = repository;
        this.healthService = healthService;
        this.clock = clock;
    }

    /**
     * Inserts a pending discovery of the given source and type built from {@code data}.
     *
     * @return the stored discovery, or {@code null} when the same source already holds the url
     */
    public Discovery addDiscovery(DiscoverySource source, String type, DiscoveryCandidate data) {
        DiscoveryCandidate candidate = new DiscoveryCandidate(
            source,
            type,
            data.title(),
            data.summary(),
            data.url(),
            data.relevance(),
            data.metadata()
        );
        return insertAll(List.of(candidate)).get(0);
    }

    /**
     * Inserts candidates in order and returns one flag per candidate, {@code false} for duplicates.
     * Duplicates inside the batch are caught as well. The collection is written once.
     */
    public List<Boolean> addDiscoveries(List<DiscoveryCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return insertAll(candidates).stream()
            .map(Objects::nonNull)
            .toList();
    }

    public QueueStatus getQueueStatus() {
        List<Discovery> all;
        synchronized (lock) {
            all = repository.findAll();
        }
        int pending = 0;
        int reviewed = 0;
        Map<String, Integer> bySource = new LinkedHashMap<>();
        for (Discovery discovery : all) {
            if (discovery.isPending()) {
                pending++;
                String key = discovery.source() == null ? "unknown" : discovery.source().id();
                bySource.merge(key, 1, Integer::sum);
            } else {
                reviewed++;
            }
        }
        return new QueueStatus(pending + reviewed, pending, reviewed, bySource, healthService.getHealth());
    }

    /**
     * Removes every discovery discovered more than {@code maxAgeDays} before now.
     *
     * @return number of removed discoveries
     */
    public int cleanupOldDiscoveries(int maxAgeDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(0, maxAgeDays)));
        synchronized (lock) {
            List<Discovery> all = repository.findAll();
            List<Discovery> kept = all.stream()
                .filter(discovery -> discovery.discoveredAt() == null || !discovery.discoveredAt().isBefore(cutoff))
                .toList();
            int removed = all.size() - kept.size();
            if (removed > 0) {
                repository.saveAll(kept);
                log.info("Removed {} discoveries older than {} days", removed, maxAgeDays);
            }
            return removed;
        }
    }

    public List<Discovery> getUnreviewed() {
        synchronized (lock) {
            return repository.findAll().stream()
                .filter(Discovery::isPending)
                .toList();
        }
    }

    public List<Discovery> getDiscoveriesBySource(DiscoverySource source) {
        synchronized (lock) {
            return repository.findAll().stream()
                .filter(discovery -> discovery.source() == source)
                .toList();
        }
    }

    /**
     * Moves a pending discovery to reviewed. Reviewing is one-way: an already reviewed discovery
     * comes back unchanged.
     */
    public Discovery markReviewed(String id, String notes) {
        synchronized (lock) {
            List<Discovery> all = repository.findAll();
            for (int i = 0; i < all.size(); i++) {
                Discovery discovery = all.get(i);
                if (!Objects.equals(discovery.id(), id)) {
                    continue;
                }
                if (!discovery.isPending()) {
                    return discovery;
                }
                Discovery reviewed = discovery.reviewed(clock.instant(), notes);
                all.set(i, reviewed);
                repository.saveAll(all);
                return reviewed;
            }
        }
        throw new DiscoveryNotFoundException(id);
    }

    private List<Discovery> insertAll(List<DiscoveryCandidate> candidates) {
        synchronized (lock) {
            List<Discovery> all = repository.findAll();
            List<Discovery> outcomes = new ArrayList<>(candidates.size());
            Instant now = clock.instant();
            int inserted = 0;
            for (DiscoveryCandidate candidate : candidates) {
                if (candidate.hasUrl() && containsUrl(all, candidate.source(), candidate.url())) {
                    outcomes.add(null);
                    continue;
                }
                Discovery discovery = Discovery.pending(UUID.randomUUID().toString(), candidate, now);
                all.add(discovery);
                outcomes.add(discovery);
                inserted++;
            }
            if (inserted > 0) {
                repository.saveAll(all);
            }
            log.debug("Queued {} of {} discoveries", inserted, candidates.size());
            return outcomes;
        }
    }

    private boolean containsUrl(List<Discovery> all, DiscoverySource source, String url) {
        for (Discovery existing : all) {
            if (existing.source() == source && Objects.equals(existing.url(), url)) {
                return true;
            }
        }
        return false;
    }
}
