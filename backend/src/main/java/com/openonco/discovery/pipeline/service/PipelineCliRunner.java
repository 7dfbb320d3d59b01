package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.model.PipelineStage;
import com.openonco.discovery.pipeline.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Command-line entry. With stage flags the pipeline runs once and the process exits; without them
 * the cron scheduler is started and the web server keeps the process alive.
 */
@Component
public class PipelineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);

    static final String USAGE = String.join("\n",
        "Usage: openonco-discovery [--crawl] [--triage] [--digest] [--export] [--all] [--help]",
        "  --crawl   run every enabled crawler once",
        "  --triage  count pending discoveries per priority",
        "  --digest  send the review digest email",
        "  --export  write the pending queue to exports/YYYY-MM-DD.md",
        "  --all     crawl, triage and export",
        "Without flags the scheduler runs until shutdown."
    );

    private final PipelineProperties properties;
    private final PipelineService pipelineService;
    private final DiscoveryScheduler scheduler;
    private final ConfigurableApplicationContext applicationContext;

    public PipelineCliRunner(
        PipelineProperties properties,
        PipelineService pipelineService,
        DiscoveryScheduler scheduler,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.scheduler = scheduler;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        CliRequest request = parse(args.getOptionNames());
        if (request.isEmpty()) {
            if (properties.getScheduler().isEnabled()) {
                scheduler.start();
            } else {
                log.info("Scheduler disabled, serving the API only");
            }
            return;
        }

        int exitCode = execute(request);
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    /**
     * Runs the requested stages and returns the process exit code.
     */
    int execute(CliRequest request) {
        if (!request.unknownFlags().isEmpty()) {
            log.error("Unknown option(s): {}", request.unknownFlags());
            log.info("\n{}", USAGE);
            return 1;
        }
        if (request.help()) {
            log.info("\n{}", USAGE);
            return 0;
        }

        List<StageResult> results = pipelineService.run(request.stages());
        boolean failed = false;
        for (StageResult result : results) {
            log.info(
                "Stage {}: success={}, found={}, added={}, failed={}, duration={}ms{}",
                result.stage(),
                result.success(),
                result.found(),
                result.added(),
                result.failed(),
                result.duration().toMillis(),
                result.error() == null ? "" : ", error=" + result.error()
            );
            failed |= !result.success();
        }
        return failed ? 1 : 0;
    }

    /**
     * Option names as Spring parses them from {@code --name[=value]}. Dotted names are property
     * overrides and are left to Spring.
     */
    static CliRequest parse(Collection<String> optionNames) {
        Set<PipelineStage> stages = EnumSet.noneOf(PipelineStage.class);
        List<String> unknown = new ArrayList<>();
        boolean help = false;
        for (String name : optionNames) {
            if (name.contains(".")) {
                continue;
            }
            if ("help".equals(name)) {
                help = true;
            } else if ("all".equals(name)) {
                stages.add(PipelineStage.CRAWL);
                stages.add(PipelineStage.TRIAGE);
                stages.add(PipelineStage.EXPORT);
            } else {
                PipelineStage stage = PipelineStage.fromFlag(name);
                if (stage == null) {
                    unknown.add("--" + name);
                } else {
                    stages.add(stage);
                }
            }
        }
        return new CliRequest(stages, help, unknown);
    }

    record CliRequest(Set<PipelineStage> stages, boolean help, List<String> unknownFlags) {
        boolean isEmpty() {
            return stages.isEmpty() && !help && unknownFlags.isEmpty();
        }
    }
}
