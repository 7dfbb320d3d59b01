package com.openonco.discovery.pipeline.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openonco.discovery.config.PipelineConfig;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.http.SourceFetchException;
import com.openonco.discovery.pipeline.http.SourceHttpFetcher;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.Relevance;
import com.openonco.discovery.pipeline.util.ReasonCodeClassifier;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeviceApprovalCrawlerTest {
    private final ObjectMapper objectMapper = new PipelineConfig().objectMapper();

    @Test
    void clearanceForMonitoredManufacturerIsHighPriorityMaterial() throws Exception {
        JsonNode device = objectMapper.readTree(
            "{\"k_number\":\"K240001\",\"device_name\":\"Guardant360 CDx\",\"applicant\":\"Guardant Health, Inc.\","
                + "\"decision_date\":\"2026-02-20\",\"product_code\":\"PQP\"}"
        );
        DeviceApprovalCrawler crawler = new DeviceApprovalCrawler(new PipelineProperties(), null, Clock.systemUTC());

        assertThat(DeviceApprovalCrawler.isRelevant(device)).isTrue();
        DiscoveryCandidate discovery = crawler.create510kDiscovery(device);

        assertThat(discovery.source()).isEqualTo(DiscoverySource.DEVICE_APPROVAL);
        assertThat(discovery.type()).isEqualTo("fda_approval");
        assertThat(discovery.title()).isEqualTo("FDA 510(k) Cleared: Guardant360 CDx");
        assertThat(discovery.url()).endsWith("pmn.cfm?ID=K240001");
        assertThat(discovery.relevance()).isEqualTo(Relevance.HIGH);
        assertThat(discovery.metadata()).containsEntry("clearanceType", "510k").containsEntry("kNumber", "K240001");
    }

    @Test
    void unrelatedDevicesAreNotRelevant() throws Exception {
        JsonNode device = objectMapper.readTree(
            "{\"k_number\":\"K240002\",\"device_name\":\"Orthopedic bone screw\",\"applicant\":\"Acme\",\"product_code\":\"HWC\"}"
        );
        assertThat(DeviceApprovalCrawler.isRelevant(device)).isFalse();

        JsonNode byCode = objectMapper.readTree("{\"pma_number\":\"P1\",\"trade_name\":\"Assay\",\"product_code\":\"PHI\"}");
        assertThat(DeviceApprovalCrawler.isRelevant(byCode)).isTrue();
    }

    @Test
    void relevanceReadsEveryFieldOfTheDecisionRecord() throws Exception {
        DeviceApprovalCrawler crawler = new DeviceApprovalCrawler(new PipelineProperties(), null, Clock.systemUTC());
        JsonNode withCommittee = objectMapper.readTree(
            "{\"pma_number\":\"P260001\",\"trade_name\":\"Cobalt Assay Kit\",\"applicant\":\"Acme Dx\","
                + "\"advisory_committee_description\":\"Oncology\"}"
        );
        JsonNode withNestedKeyword = objectMapper.readTree(
            "{\"pma_number\":\"P260002\",\"trade_name\":\"Cobalt Assay Kit\",\"applicant\":\"Acme Dx\","
                + "\"openfda\":{\"device_name\":\"ctDNA next generation sequencing panel\"}}"
        );
        JsonNode plain = objectMapper.readTree(
            "{\"pma_number\":\"P260003\",\"trade_name\":\"Cobalt Assay Kit\",\"applicant\":\"Acme Dx\"}"
        );

        assertThat(crawler.createPmaDiscovery(withCommittee).relevance()).isEqualTo(Relevance.MEDIUM);
        assertThat(crawler.createPmaDiscovery(withNestedKeyword).relevance()).isEqualTo(Relevance.HIGH);
        assertThat(crawler.createPmaDiscovery(plain).relevance()).isEqualTo(Relevance.LOW);
    }

    @Test
    void emptyRangeIsNotAFailure() {
        SourceHttpFetcher fetcher = Mockito.mock(SourceHttpFetcher.class);
        when(fetcher.fetchJson(anyString(), anyMap(), anyLong()))
            .thenThrow(new SourceFetchException(ReasonCodeClassifier.HTTP_404, "https://api.fda.gov", "HTTP 404"));
        PipelineProperties properties = new PipelineProperties();
        properties.setCrawlers(Map.of("device-approval", new PipelineProperties.Crawler()));
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T00:00:00Z"), ZoneOffset.UTC);

        List<DiscoveryCandidate> discoveries = new DeviceApprovalCrawler(properties, fetcher, clock).crawl();

        assertThat(discoveries).isEmpty();
        ArgumentCaptor<String> urls = ArgumentCaptor.forClass(String.class);
        verify(fetcher, times(2)).fetchJson(urls.capture(), anyMap(), anyLong());
        assertThat(urls.getAllValues().get(0))
            .isEqualTo("https://api.fda.gov/device/510k.json?search=decision_date:%5B20260131+TO+20260302%5D&limit=100");
        verify(fetcher).fetchJson(contains("/device/pma.json"), anyMap(), anyLong());
    }
}
