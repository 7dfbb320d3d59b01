package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.crawler.CrawlerRegistry;
import com.openonco.discovery.pipeline.crawler.SourceCrawler;
import com.openonco.discovery.pipeline.digest.DigestDispatcher;
import com.openonco.discovery.pipeline.model.CleanupResult;
import com.openonco.discovery.pipeline.model.CrawlResult;
import com.openonco.discovery.pipeline.model.CrawlerStatus;
import com.openonco.discovery.pipeline.model.DigestResult;
import com.openonco.discovery.pipeline.model.SchedulerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cron-driven jobs: one per enabled crawler, a daily cleanup and the weekly digest. Cron
 * expressions use the five-field form and are evaluated in UTC.
 */
@Service
public class DiscoveryScheduler {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryScheduler.class);

    static final String CLEANUP_JOB = "cleanup";
    static final String DIGEST_JOB = "digest";
    private static final String CRAWLER_JOB_PREFIX = "crawler:";

    private final ThreadPoolTaskScheduler taskScheduler;
    private final CrawlerRegistry registry;
    private final CrawlerRunner runner;
    private final DigestDispatcher dispatcher;
    private final DiscoveryQueueService queueService;
    private final CrawlerHealthService healthService;
    private final PipelineProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();

    public DiscoveryScheduler(
        @Qualifier("pipelineTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
        CrawlerRegistry registry,
        CrawlerRunner runner,
        DigestDispatcher dispatcher,
        DiscoveryQueueService queueService,
        CrawlerHealthService healthService,
        PipelineProperties properties
    ) {
        this.taskScheduler = taskScheduler;
        this.registry = registry;
        this.runner = runner;
        this.dispatcher = dispatcher;
        this.queueService = queueService;
        this.healthService = healthService;
        this.properties = properties;
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            for (SourceCrawler crawler : registry.enabled()) {
                String cron = properties.crawler(crawler.source()).getCron();
                schedule(CRAWLER_JOB_PREFIX + crawler.source().id(), cron, () -> runCrawlerJob(crawler));
            }
            schedule(CLEANUP_JOB, properties.getCleanup().getCron(), this::runCleanupJob);
            if (properties.getDigest().isEnabled()) {
                schedule(DIGEST_JOB, properties.getDigest().getCron(), this::runDigestJob);
            }
            running.set(true);
            log.info("Scheduler started with {} jobs: {}", jobs.size(), jobs.keySet());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            for (ScheduledJob job : jobs.values()) {
                job.future().cancel(false);
            }
            jobs.clear();
            log.info("Scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatus getSchedulerStatus() {
        List<String> jobNames;
        Map<String, String> schedules = new LinkedHashMap<>();
        synchronized (lifecycleLock) {
            jobNames = new ArrayList<>(jobs.keySet());
            jobs.forEach((key, job) -> schedules.put(key, job.cron()));
        }
        List<CrawlerStatus> crawlerStatuses = new ArrayList<>();
        for (SourceCrawler crawler : registry.all()) {
            crawlerStatuses.add(new CrawlerStatus(
                crawler.source(),
                crawler.name(),
                crawler.isEnabled(),
                crawler.rateLimit(),
                properties.crawler(crawler.source()).getCron(),
                healthService.getHealth(crawler.source())
            ));
        }
        return new SchedulerStatus(running.get(), jobNames.size(), jobNames, schedules, crawlerStatuses);
    }

    /**
     * Runs one crawler immediately on the calling thread, followed by the same post-crawl
     * notification a scheduled run sends.
     *
     * @throws UnknownSourceException when no crawler serves {@code sourceId}
     */
    public CrawlResult triggerCrawler(String sourceId) {
        SourceCrawler crawler = registry.get(sourceId);
        log.info("Manually triggering crawler {}", crawler.source());
        return crawlAndNotify(crawler);
    }

    public List<CrawlResult> runAllCrawlersNow() {
        List<CrawlResult> results = new ArrayList<>();
        for (SourceCrawler crawler : registry.enabled()) {
            results.add(runner.run(crawler));
        }
        return results;
    }

    public DigestResult triggerDigest() {
        return dispatcher.sendDigest();
    }

    public CleanupResult runCleanup() {
        int maxAgeDays = properties.getCleanup().getMaxAgeDays();
        int removed = queueService.cleanupOldDiscoveries(maxAgeDays);
        int remaining = queueService.getQueueStatus().total();
        return new CleanupResult(removed, remaining, maxAgeDays);
    }

    /**
     * Five-field cron as written in configuration, turned into Spring's six-field form.
     */
    static CronTrigger trigger(String cron) {
        return new CronTrigger("0 " + cron.trim(), ZoneOffset.UTC);
    }

    private void schedule(String key, String cron, Runnable task) {
        try {
            ScheduledFuture<?> future = taskScheduler.schedule(task, trigger(cron));
            if (future != null) {
                jobs.put(key, new ScheduledJob(key, cron, future));
            }
        } catch (IllegalArgumentException e) {
            log.error("Invalid cron '{}' for job {}, job not scheduled", cron, key, e);
        }
    }

    private CrawlResult crawlAndNotify(SourceCrawler crawler) {
        CrawlResult result = runner.run(crawler);
        dispatcher.notifyCrawlComplete(result);
        return result;
    }

    private void runCrawlerJob(SourceCrawler crawler) {
        try {
            crawlAndNotify(crawler);
        } catch (Exception e) {
            log.error("Scheduled crawl for {} failed", crawler.source(), e);
        }
    }

    private void runCleanupJob() {
        try {
            CleanupResult result = runCleanup();
            log.info("Cleanup removed {} discoveries, {} remain", result.removed(), result.remaining());
        } catch (Exception e) {
            log.error("Scheduled cleanup failed", e);
        }
    }

    private void runDigestJob() {
        try {
            DigestResult result = dispatcher.sendDigest();
            if (!result.success()) {
                log.warn("Scheduled digest not delivered: {}", result.error());
            }
        } catch (Exception e) {
            log.error("Scheduled digest failed", e);
        }
    }

    private record ScheduledJob(String key, String cron, ScheduledFuture<?> future) {
    }
}
