package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.pipeline.model.Discovery;
import com.openonco.discovery.pipeline.model.Priority;
import com.openonco.discovery.pipeline.model.TriageSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic triage of the pending queue into priority buckets.
 */
@Service
public class TriageService {
    private static final Logger log = LoggerFactory.getLogger(TriageService.class);

    private final DiscoveryQueueService queueService;

    public TriageService(DiscoveryQueueService queueService) {
        this.queueService = queueService;
    }

    public TriageSummary triage() {
        TriageSummary summary = summarize(queueService.getUnreviewed());
        log.info(
            "Triage: {} pending (high={}, medium={}, low={})",
            summary.pending(),
            summary.byPriority().get(Priority.HIGH),
            summary.byPriority().get(Priority.MEDIUM),
            summary.byPriority().get(Priority.LOW)
        );
        return summary;
    }

    static TriageSummary summarize(List<Discovery> pending) {
        Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            byPriority.put(priority, 0);
        }
        Map<String, Integer> bySource = new LinkedHashMap<>();
        for (Discovery discovery : pending) {
            byPriority.merge(Priority.of(discovery), 1, Integer::sum);
            String source = discovery.source() == null ? "unknown" : discovery.source().id();
            bySource.merge(source, 1, Integer::sum);
        }
        return new TriageSummary(pending.size(), byPriority, bySource);
    }
}
