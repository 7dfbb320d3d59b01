package com.openonco.discovery.pipeline.model;

import java.util.List;
import java.util.Map;

public record SchedulerStatus(
    boolean running,
    int activeJobs,
    List<String> jobs,
    Map<String, String> schedules,
    List<CrawlerStatus> crawlerStatuses
) {
}
