package com.openonco.discovery.pipeline.export;

import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.digest.DigestDispatcher;
import com.openonco.discovery.pipeline.model.Discovery;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.ExportResult;
import com.openonco.discovery.pipeline.model.Priority;
import com.openonco.discovery.pipeline.model.QueueStatus;
import com.openonco.discovery.pipeline.persistence.PersistenceException;
import com.openonco.discovery.pipeline.service.DiscoveryQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Writes the pending queue as a dated Markdown review sheet. Each discovery sits between
 * {@code <!-- DISCOVERY id -->} and {@code <!-- /DISCOVERY -->} markers so reviewers can find it.
 */
@Service
public class MarkdownExportService {
    private static final Logger log = LoggerFactory.getLogger(MarkdownExportService.class);

    private final DiscoveryQueueService queueService;
    private final PipelineProperties properties;
    private final Clock clock;

    public MarkdownExportService(DiscoveryQueueService queueService, PipelineProperties properties, Clock clock) {
        this.queueService = queueService;
        this.properties = properties;
        this.clock = clock;
    }

    public ExportResult export() {
        QueueStatus status = queueService.getQueueStatus();
        List<Discovery> pending = queueService.getUnreviewed();
        LocalDate day = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        String markdown = render(day, status, DigestDispatcher.groupByPriority(pending));

        Path target = exportDir().resolve(day + ".md");
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, markdown, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write export " + target, e);
        }
        log.info("Exported {} pending discoveries to {}", pending.size(), target);
        return new ExportResult(target, pending.size());
    }

    Path exportDir() {
        String configured = properties.getDigest().getExportDir();
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured);
        }
        return Paths.get(properties.getData().getDir(), "exports");
    }

    static String render(LocalDate day, QueueStatus status, Map<Priority, Map<DiscoverySource, List<Discovery>>> grouped) {
        StringBuilder out = new StringBuilder();
        out.append("# OpenOnco Discoveries - ").append(day).append("\n\n");
        out.append("Pending: ").append(status.pending())
            .append(" | Reviewed: ").append(status.reviewed())
            .append(" | Total: ").append(status.total()).append("\n\n");

        out.append("## Summary by priority\n\n| Priority | Count |\n|---|---|\n");
        for (Priority priority : Priority.values()) {
            out.append("| ").append(priority.id()).append(" | ").append(count(grouped.get(priority))).append(" |\n");
        }
        out.append("\n## Summary by source\n\n| Source | Pending |\n|---|---|\n");
        status.bySource().forEach((source, count) ->
            out.append("| ").append(source).append(" | ").append(count).append(" |\n"));

        for (Priority priority : Priority.values()) {
            Map<DiscoverySource, List<Discovery>> bySource = grouped.get(priority);
            if (bySource == null || bySource.isEmpty()) {
                continue;
            }
            out.append("\n## ").append(priority.name()).append(" priority\n");
            for (Map.Entry<DiscoverySource, List<Discovery>> entry : bySource.entrySet()) {
                out.append("\n### ").append(entry.getKey().id()).append("\n");
                for (Discovery discovery : entry.getValue()) {
                    appendDiscovery(out, discovery);
                }
            }
        }
        return out.toString();
    }

    private static void appendDiscovery(StringBuilder out, Discovery discovery) {
        out.append("\n<!-- DISCOVERY ").append(discovery.id()).append(" -->\n");
        out.append("#### ").append(discovery.title()).append("\n\n");
        out.append("- Type: ").append(discovery.type()).append("\n");
        out.append("- Relevance: ").append(discovery.relevance().id()).append("\n");
        if (discovery.hasUrl()) {
            out.append("- URL: ").append(discovery.url()).append("\n");
        }
        if (discovery.discoveredAt() != null) {
            out.append("- Discovered: ").append(discovery.discoveredAt()).append("\n");
        }
        if (discovery.summary() != null && !discovery.summary().isBlank()) {
            out.append("\n").append(discovery.summary()).append("\n");
        }
        out.append("<!-- /DISCOVERY -->\n");
    }

    private static int count(Map<DiscoverySource, List<Discovery>> bySource) {
        return bySource == null ? 0 : bySource.values().stream().mapToInt(List::size).sum();
    }
}
