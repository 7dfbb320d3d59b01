package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.pipeline.export.MarkdownExportService;
import com.openonco.discovery.pipeline.model.CrawlResult;
import com.openonco.discovery.pipeline.model.DigestResult;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.ExportResult;
import com.openonco.discovery.pipeline.model.PipelineStage;
import com.openonco.discovery.pipeline.model.Priority;
import com.openonco.discovery.pipeline.model.Relevance;
import com.openonco.discovery.pipeline.model.StageResult;
import com.openonco.discovery.pipeline.model.TriageSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    @Mock
    private DiscoveryScheduler scheduler;

    @Mock
    private TriageService triageService;

    @Mock
    private MarkdownExportService exportService;

    @InjectMocks
    private PipelineService pipelineService;

    @Test
    void stagesRunInPipelineOrder() {
        when(scheduler.runAllCrawlersNow()).thenReturn(List.of());
        when(exportService.export()).thenReturn(new ExportResult(Path.of("data/exports/2026-03-02.md"), 0));
        when(triageService.triage()).thenReturn(new TriageSummary(0, Map.of(Priority.HIGH, 0), Map.of()));

        List<StageResult> results = pipelineService.run(EnumSet.of(PipelineStage.EXPORT, PipelineStage.CRAWL, PipelineStage.TRIAGE));

        assertThat(results).extracting(StageResult::stage).containsExactly("crawl", "triage", "export");
        assertThat(results).allMatch(StageResult::success);
    }

    @Test
    void crawlStageSumsResultsAndFailsWhenAnyCrawlerFailed() {
        DiscoveryCandidate candidate = new DiscoveryCandidate(
            DiscoverySource.VENDOR, "vendor_coverage_announcement", "t", null, "https://v/1", Relevance.MEDIUM, Map.of()
        );
        when(scheduler.runAllCrawlersNow()).thenReturn(List.of(
            CrawlResult.success(DiscoverySource.VENDOR, List.of(candidate, candidate), 1, Duration.ofMillis(3)),
            CrawlResult.failure(DiscoverySource.PAYER, Duration.ofMillis(2), "timeout")
        ));

        StageResult result = pipelineService.runStage(PipelineStage.CRAWL);

        assertThat(result.success()).isFalse();
        assertThat(result.found()).isEqualTo(2);
        assertThat(result.added()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.error()).contains("payer");
    }

    @Test
    void digestStageReflectsDeliveryOutcome() {
        when(scheduler.triggerDigest()).thenReturn(DigestResult.failed(4, "No digest recipients configured"));

        StageResult result = pipelineService.runStage(PipelineStage.DIGEST);

        assertThat(result.success()).isFalse();
        assertThat(result.found()).isEqualTo(4);
        assertThat(result.error()).contains("recipients");
        verifyNoInteractions(exportService, triageService);
    }

    @Test
    void unexpectedStageExceptionBecomesFailedStage() {
        when(exportService.export()).thenThrow(new IllegalStateException("read-only file system"));

        StageResult result = pipelineService.runStage(PipelineStage.EXPORT);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("read-only file system");
    }
}
