package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.HealthRecord;
import com.openonco.discovery.pipeline.persistence.HealthRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class CrawlerHealthService {
    private static final int MAX_ERROR_LENGTH = 500;

    private final HealthRepository repository;
    private final Clock clock;
    private final Object lock = new Object();

    public CrawlerHealthService(HealthRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public HealthRecord recordSuccess(DiscoverySource source) {
        synchronized (lock) {
            Map<String, HealthRecord> all = repository.findAll();
            HealthRecord updated = all.getOrDefault(source.id(), HealthRecord.empty()).withSuccess(clock.instant());
            all.put(source.id(), updated);
            repository.saveAll(all);
            return updated;
        }
    }

    public HealthRecord recordError(DiscoverySource source, String message) {
        synchronized (lock) {
            Map<String, HealthRecord> all = repository.findAll();
            HealthRecord updated = all.getOrDefault(source.id(), HealthRecord.empty())
                .withError(clock.instant(), truncate(message));
            all.put(source.id(), updated);
            repository.saveAll(all);
            return updated;
        }
    }

    public Map<String, HealthRecord> getHealth() {
        synchronized (lock) {
            return new LinkedHashMap<>(repository.findAll());
        }
    }

    public HealthRecord getHealth(DiscoverySource source) {
        return getHealth().get(source.id());
    }

    private String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
