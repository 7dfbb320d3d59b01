package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.model.PipelineStage;
import com.openonco.discovery.pipeline.model.StageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PipelineCliRunnerTest {
    private PipelineProperties properties;
    private PipelineService pipelineService;
    private DiscoveryScheduler scheduler;
    private PipelineCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getCli().setExitAfterRun(false);
        pipelineService = Mockito.mock(PipelineService.class);
        scheduler = Mockito.mock(DiscoveryScheduler.class);
        runner = new PipelineCliRunner(properties, pipelineService, scheduler, Mockito.mock(ConfigurableApplicationContext.class));
    }

    @Test
    void allExpandsToCrawlTriageAndExport() {
        PipelineCliRunner.CliRequest request = PipelineCliRunner.parse(List.of("all"));
        assertThat(request.stages()).containsExactly(PipelineStage.CRAWL, PipelineStage.TRIAGE, PipelineStage.EXPORT);
        assertThat(request.unknownFlags()).isEmpty();
    }

    @Test
    void propertyOverridesAreNotTreatedAsFlags() {
        PipelineCliRunner.CliRequest request = PipelineCliRunner.parse(List.of("spring.profiles.active", "digest"));
        assertThat(request.stages()).containsExactly(PipelineStage.DIGEST);
        assertThat(request.unknownFlags()).isEmpty();
    }

    @Test
    void unknownFlagExitsWithOneWithoutRunningStages() {
        int exitCode = runner.execute(PipelineCliRunner.parse(List.of("crawl", "reindex")));

        assertThat(exitCode).isEqualTo(1);
        verifyNoInteractions(pipelineService);
    }

    @Test
    void failedStageExitsWithOne() {
        when(pipelineService.run(any())).thenReturn(List.of(
            new StageResult("crawl", true, 3, 1, 0, Duration.ofMillis(10), null),
            new StageResult("digest", false, 0, 0, 1, Duration.ofMillis(2), "No digest recipients configured")
        ));

        assertThat(runner.execute(PipelineCliRunner.parse(List.of("crawl", "digest")))).isEqualTo(1);
    }

    @Test
    void successfulStagesExitWithZero() {
        when(pipelineService.run(any())).thenReturn(List.of(
            new StageResult("triage", true, 0, 0, 0, Duration.ofMillis(1), null)
        ));

        assertThat(runner.execute(PipelineCliRunner.parse(List.of("triage")))).isZero();
    }

    @Test
    void helpPrintsUsageOnly() {
        assertThat(runner.execute(PipelineCliRunner.parse(List.of("help")))).isZero();
        verifyNoInteractions(pipelineService);
    }

    @Test
    void noFlagsStartsSchedulerWhenEnabled() throws Exception {
        runner.run(new DefaultApplicationArguments());
        verify(scheduler).start();

        properties.getScheduler().setEnabled(false);
        Mockito.clearInvocations(scheduler);
        runner.run(new DefaultApplicationArguments());
        verify(scheduler, never()).start();
    }
}
