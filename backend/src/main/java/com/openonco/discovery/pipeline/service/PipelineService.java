package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.pipeline.export.MarkdownExportService;
import com.openonco.discovery.pipeline.model.CrawlResult;
import com.openonco.discovery.pipeline.model.DigestResult;
import com.openonco.discovery.pipeline.model.ExportResult;
import com.openonco.discovery.pipeline.model.PipelineStage;
import com.openonco.discovery.pipeline.model.StageResult;
import com.openonco.discovery.pipeline.model.TriageSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the one-shot pipeline stages in their fixed order: crawl, triage, digest, export.
 */
@Service
public class PipelineService {
    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final DiscoveryScheduler scheduler;
    private final TriageService triageService;
    private final MarkdownExportService exportService;

    public PipelineService(
        DiscoveryScheduler scheduler,
        TriageService triageService,
        MarkdownExportService exportService
    ) {
        this.scheduler = scheduler;
        this.triageService = triageService;
        this.exportService = exportService;
    }

    public List<StageResult> run(Collection<PipelineStage> stages) {
        List<StageResult> results = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            if (stages.contains(stage)) {
                results.add(runStage(stage));
            }
        }
        return results;
    }

    public StageResult runStage(PipelineStage stage) {
        long startedAt = System.nanoTime();
        try {
            return switch (stage) {
                case CRAWL -> crawl(startedAt);
                case TRIAGE -> triage(startedAt);
                case DIGEST -> digest(startedAt);
                case EXPORT -> export(startedAt);
            };
        } catch (Exception e) {
            log.error("Stage {} failed", stage.flag(), e);
            return new StageResult(stage.flag(), false, 0, 0, 0, elapsed(startedAt), e.getMessage());
        }
    }

    private StageResult crawl(long startedAt) {
        List<CrawlResult> results = scheduler.runAllCrawlersNow();
        int found = 0;
        int added = 0;
        List<String> failedSources = new ArrayList<>();
        for (CrawlResult result : results) {
            found += result.found();
            added += result.added();
            if (!result.success()) {
                failedSources.add(result.source().id());
            }
        }
        String error = failedSources.isEmpty()
            ? null
            : failedSources.size() + " crawler(s) failed: " + failedSources.stream().collect(Collectors.joining(", "));
        return new StageResult("crawl", failedSources.isEmpty(), found, added, failedSources.size(), elapsed(startedAt), error);
    }

    private StageResult triage(long startedAt) {
        TriageSummary summary = triageService.triage();
        return new StageResult("triage", true, summary.pending(), 0, 0, elapsed(startedAt), null);
    }

    private StageResult digest(long startedAt) {
        DigestResult result = scheduler.triggerDigest();
        return new StageResult(
            "digest",
            result.success(),
            result.pendingCount(),
            0,
            result.success() ? 0 : 1,
            elapsed(startedAt),
            result.error()
        );
    }

    private StageResult export(long startedAt) {
        ExportResult result = exportService.export();
        return new StageResult("export", true, result.discoveries(), 0, 0, elapsed(startedAt), null);
    }

    private Duration elapsed(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt);
    }
}
