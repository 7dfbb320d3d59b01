package com.openonco.discovery.pipeline.digest;

import com.openonco.discovery.pipeline.model.CrawlResult;
import com.openonco.discovery.pipeline.model.DigestContent;
import com.openonco.discovery.pipeline.model.DigestReport;
import com.openonco.discovery.pipeline.model.QueueStatus;

public interface DigestRenderer {
    DigestContent renderDigest(DigestReport report);

    DigestContent renderCrawlNotification(CrawlResult result, QueueStatus status);
}
