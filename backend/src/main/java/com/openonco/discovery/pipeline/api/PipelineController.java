package com.openonco.discovery.pipeline.api;

import com.openonco.discovery.pipeline.export.MarkdownExportService;
import com.openonco.discovery.pipeline.model.CleanupResult;
import com.openonco.discovery.pipeline.model.CrawlResult;
import com.openonco.discovery.pipeline.model.DigestResult;
import com.openonco.discovery.pipeline.model.Discovery;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.ExportResult;
import com.openonco.discovery.pipeline.model.QueueStatus;
import com.openonco.discovery.pipeline.model.SchedulerStatus;
import com.openonco.discovery.pipeline.service.DiscoveryQueueService;
import com.openonco.discovery.pipeline.service.DiscoveryScheduler;
import com.openonco.discovery.pipeline.service.UnknownSourceException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {
    private final DiscoveryQueueService queueService;
    private final DiscoveryScheduler scheduler;
    private final MarkdownExportService exportService;

    public PipelineController(
        DiscoveryQueueService queueService,
        DiscoveryScheduler scheduler,
        MarkdownExportService exportService
    ) {
        this.queueService = queueService;
        this.scheduler = scheduler;
        this.exportService = exportService;
    }

    @GetMapping("/status")
    public QueueStatus status() {
        return queueService.getQueueStatus();
    }

    @GetMapping("/discoveries")
    public List<Discovery> discoveries(@RequestParam(name = "source", required = false) String source) {
        List<Discovery> pending = queueService.getUnreviewed();
        if (source == null || source.isBlank()) {
            return pending;
        }
        DiscoverySource resolved = DiscoverySource.fromId(source);
        if (resolved == null) {
            throw new UnknownSourceException(source);
        }
        return pending.stream()
            .filter(discovery -> discovery.source() == resolved)
            .toList();
    }

    @PostMapping("/discoveries/{id}/review")
    public Discovery review(@PathVariable("id") String id, @RequestBody(required = false) ReviewRequest request) {
        return queueService.markReviewed(id, request == null ? null : request.notes());
    }

    @GetMapping("/scheduler")
    public SchedulerStatus scheduler() {
        return scheduler.getSchedulerStatus();
    }

    @PostMapping("/scheduler/start")
    public SchedulerStatus startScheduler() {
        scheduler.start();
        return scheduler.getSchedulerStatus();
    }

    @PostMapping("/scheduler/stop")
    public SchedulerStatus stopScheduler() {
        scheduler.stop();
        return scheduler.getSchedulerStatus();
    }

    @PostMapping("/crawlers/{source}/run")
    public CrawlResult runCrawler(@PathVariable("source") String source) {
        return scheduler.triggerCrawler(source);
    }

    @PostMapping("/crawlers/run-all")
    public List<CrawlResult> runAllCrawlers() {
        return scheduler.runAllCrawlersNow();
    }

    @PostMapping("/digest")
    public DigestResult digest() {
        return scheduler.triggerDigest();
    }

    @PostMapping("/cleanup")
    public CleanupResult cleanup() {
        return scheduler.runCleanup();
    }

    @PostMapping("/export")
    public Map<String, Object> export() {
        ExportResult result = exportService.export();
        return Map.of("path", result.path().toString(), "discoveries", result.discoveries());
    }
}
