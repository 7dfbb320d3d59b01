package com.openonco.discovery.pipeline.digest;

import com.openonco.discovery.pipeline.model.CrawlResult;
import com.openonco.discovery.pipeline.model.DigestContent;
import com.openonco.discovery.pipeline.model.DigestReport;
import com.openonco.discovery.pipeline.model.DigestResult;
import com.openonco.discovery.pipeline.model.Discovery;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.Priority;
import com.openonco.discovery.pipeline.model.QueueStatus;
import com.openonco.discovery.pipeline.service.DiscoveryQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and delivers the review digest. Delivery failures are logged and reported in the result,
 * never thrown, and never retried.
 */
@Service
public class DigestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(DigestDispatcher.class);

    private final DiscoveryQueueService queueService;
    private final DigestRenderer renderer;
    private final DigestMailer mailer;
    private final Clock clock;

    private volatile Instant lastDigestSentAt;

    public DigestDispatcher(
        DiscoveryQueueService queueService,
        DigestRenderer renderer,
        DigestMailer mailer,
        Clock clock
    ) {
        this.queueService = queueService;
        this.renderer = renderer;
        this.mailer = mailer;
        this.clock = clock;
    }

    public DigestResult sendDigest() {
        int pending = 0;
        try {
            QueueStatus status = queueService.getQueueStatus();
            pending = status.pending();
            List<Discovery> unreviewed = queueService.getUnreviewed();
            DigestReport report = new DigestReport(clock.instant(), status, groupByPriority(unreviewed));
            DigestContent content = renderer.renderDigest(report);
            String messageId = mailer.send(content);
            lastDigestSentAt = clock.instant();
            log.info("Digest sent with {} pending discoveries (id={})", pending, messageId);
            return DigestResult.sent(messageId, pending);
        } catch (Exception e) {
            log.warn("Digest delivery failed: {}", e.getMessage());
            return DigestResult.failed(pending, e.getMessage());
        }
    }

    /**
     * Sends a short notice after a successful crawl, but only while the queue holds pending items.
     */
    public DigestResult notifyCrawlComplete(CrawlResult result) {
        if (result == null || !result.success()) {
            return DigestResult.skipped(0, "crawl did not succeed");
        }
        int pending = 0;
        try {
            QueueStatus status = queueService.getQueueStatus();
            pending = status.pending();
            if (pending == 0) {
                log.debug("No pending discoveries after {} crawl, skipping notification", result.source());
                return DigestResult.skipped(0, "nothing pending");
            }
            String messageId = mailer.send(renderer.renderCrawlNotification(result, status));
            log.info("Crawl notification sent for {} (id={})", result.source(), messageId);
            return DigestResult.sent(messageId, pending);
        } catch (Exception e) {
            log.warn("Crawl notification for {} failed: {}", result.source(), e.getMessage());
            return DigestResult.failed(pending, e.getMessage());
        }
    }

    /**
     * Groups discoveries by priority (high, medium, low) and then by source, keeping queue order
     * inside each source. Every priority is present in the result, possibly empty.
     */
    public static Map<Priority, Map<DiscoverySource, List<Discovery>>> groupByPriority(List<Discovery> discoveries) {
        Map<Priority, Map<DiscoverySource, List<Discovery>>> grouped = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            grouped.put(priority, new LinkedHashMap<>());
        }
        for (Discovery discovery : discoveries) {
            if (discovery.source() == null) {
                continue;
            }
            grouped.get(Priority.of(discovery))
                .computeIfAbsent(discovery.source(), ignored -> new ArrayList<>())
                .add(discovery);
        }
        return grouped;
    }

    public Instant getLastDigestSentAt() {
        return lastDigestSentAt;
    }
}
