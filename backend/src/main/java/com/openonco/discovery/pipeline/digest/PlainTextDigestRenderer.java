package com.openonco.discovery.pipeline.digest;

import com.openonco.discovery.pipeline.model.CrawlResult;
import com.openonco.discovery.pipeline.model.DigestContent;
import com.openonco.discovery.pipeline.model.DigestReport;
import com.openonco.discovery.pipeline.model.Discovery;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.HealthRecord;
import com.openonco.discovery.pipeline.model.Priority;
import com.openonco.discovery.pipeline.model.QueueStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Renders digests as a plain-text body with a minimal HTML twin.
 */
@Component
public class PlainTextDigestRenderer implements DigestRenderer {
    static final int MAX_ITEMS_PER_SOURCE = 10;
    static final Duration ERROR_WINDOW = Duration.ofDays(7);

    @Override
    public DigestContent renderDigest(DigestReport report) {
        QueueStatus status = report.queueStatus();
        LocalDate day = LocalDate.ofInstant(report.generatedAt(), ZoneOffset.UTC);
        int recentErrors = recentErrors(status.health(), report.generatedAt());
        String subject = digestSubject(status.pending(), recentErrors);

        StringBuilder text = new StringBuilder();
        StringBuilder html = new StringBuilder("<h1>").append(escape(subject)).append("</h1>");
        text.append(subject).append("\n");
        text.append("Digest for ").append(day).append("\n\n");
        html.append("<p>Digest for ").append(day).append("</p>");
        text.append("Pending: ").append(status.pending())
            .append(" | Reviewed: ").append(status.reviewed())
            .append(" | Total: ").append(status.total()).append("\n");
        html.append("<p>Pending: ").append(status.pending())
            .append(" | Reviewed: ").append(status.reviewed())
            .append(" | Total: ").append(status.total()).append("</p>");

        for (Priority priority : Priority.values()) {
            int count = report.count(priority);
            if (count == 0) {
                continue;
            }
            String heading = priority.name() + " priority (" + count + ")";
            text.append("\n== ").append(heading).append(" ==\n");
            html.append("<h2>").append(escape(heading)).append("</h2>");
            for (Map.Entry<DiscoverySource, List<Discovery>> entry : report.grouped().get(priority).entrySet()) {
                appendSource(text, html, entry.getKey(), entry.getValue());
            }
        }

        appendHealth(text, html, status.health());
        return new DigestContent(subject, html.toString(), text.toString());
    }

    /**
     * Crawler errors lead the subject; otherwise it counts pending discoveries, or says there is
     * nothing new.
     */
    static String digestSubject(int pending, int recentErrors) {
        if (recentErrors > 0) {
            return "[OpenOnco] " + recentErrors + " crawler error" + (recentErrors == 1 ? "" : "s")
                + " + " + pending + " discoveries";
        }
        if (pending > 0) {
            return "[OpenOnco] " + pending + " coverage updates to review";
        }
        return "[OpenOnco] Weekly digest - no new updates";
    }

    /**
     * Sources whose last error happened within {@link #ERROR_WINDOW} before {@code now}.
     */
    static int recentErrors(Map<String, HealthRecord> health, Instant now) {
        if (health == null || now == null) {
            return 0;
        }
        Instant since = now.minus(ERROR_WINDOW);
        return (int) health.values().stream()
            .filter(record -> record.lastError() != null && !record.lastError().isBefore(since))
            .count();
    }

    @Override
    public DigestContent renderCrawlNotification(CrawlResult result, QueueStatus status) {
        String subject = "OpenOnco crawl complete: " + result.source() + " (" + result.added() + " new)";
        String body = "Source: " + result.source()
            + "\nFound: " + result.found()
            + "\nAdded: " + result.added()
            + "\nDuration: " + result.duration().toMillis() + "ms"
            + "\nPending review: " + status.pending() + "\n";
        String html = "<h1>" + escape(subject) + "</h1><pre>" + escape(body) + "</pre>";
        return new DigestContent(subject, html, body);
    }

    private void appendSource(StringBuilder text, StringBuilder html, DiscoverySource source, List<Discovery> items) {
        text.append("\n").append(source).append(" (").append(items.size()).append(")\n");
        html.append("<h3>").append(escape(source.id())).append(" (").append(items.size()).append(")</h3><ul>");
        items.stream().limit(MAX_ITEMS_PER_SOURCE).forEach(discovery -> {
            text.append("- ").append(discovery.title());
            if (discovery.hasUrl()) {
                text.append(" <").append(discovery.url()).append(">");
            }
            text.append("\n");
            html.append("<li>");
            if (discovery.hasUrl()) {
                html.append("<a href=\"").append(escape(discovery.url())).append("\">")
                    .append(escape(discovery.title())).append("</a>");
            } else {
                html.append(escape(discovery.title()));
            }
            if (discovery.summary() != null && !discovery.summary().isBlank()) {
                html.append("<br/><small>").append(escape(discovery.summary())).append("</small>");
            }
            html.append("</li>");
        });
        if (items.size() > MAX_ITEMS_PER_SOURCE) {
            int more = items.size() - MAX_ITEMS_PER_SOURCE;
            text.append("  ... and ").append(more).append(" more\n");
            html.append("<li>... and ").append(more).append(" more</li>");
        }
        html.append("</ul>");
    }

    private void appendHealth(StringBuilder text, StringBuilder html, Map<String, HealthRecord> health) {
        if (health == null || health.isEmpty()) {
            return;
        }
        text.append("\n== Crawler health ==\n");
        html.append("<h2>Crawler health</h2><ul>");
        health.forEach((source, record) -> {
            String line = source + ": " + record.successCount() + " ok, " + record.errorCount() + " failed"
                + (record.lastErrorMessage() == null ? "" : " (last error: " + record.lastErrorMessage() + ")");
            text.append("- ").append(line).append("\n");
            html.append("<li>").append(escape(line)).append("</li>");
        });
        html.append("</ul>");
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
