package com.openonco.discovery.pipeline.api;

import com.openonco.discovery.pipeline.model.Discovery;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.Relevance;
import com.openonco.discovery.pipeline.service.DiscoveryQueueService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class PipelineApiSmokeTest {

    @DynamicPropertySource
    static void dataDir(DynamicPropertyRegistry registry) throws IOException {
        String dir = Files.createTempDirectory("openonco-api").toString();
        registry.add("pipeline.data.dir", () -> dir);
    }

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private DiscoveryQueueService queueService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusReportsQueueCounts() throws Exception {
        mockMvc.perform(get("/api/pipeline/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.pending").value(greaterThanOrEqualTo(0)));
    }

    @Test
    void schedulerIsIdleInTests() throws Exception {
        mockMvc.perform(get("/api/pipeline/scheduler"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.activeJobs").value(0));
    }

    @Test
    void unknownCrawlerIsNotFound() throws Exception {
        mockMvc.perform(post("/api/pipeline/crawlers/rss/run"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("unknown_source"));
    }

    @Test
    void unknownSourceFilterIsNotFound() throws Exception {
        mockMvc.perform(get("/api/pipeline/discoveries").param("source", "rss"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("unknown_source"));
    }

    @Test
    void reviewingMissingDiscoveryIsNotFound() throws Exception {
        mockMvc.perform(post("/api/pipeline/discoveries/does-not-exist/review"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("discovery_not_found"));
    }

    @Test
    void reviewMovesDiscoveryOutOfPendingList() throws Exception {
        String url = "https://example.org/news/" + UUID.randomUUID();
        Discovery added = queueService.addDiscovery(
            DiscoverySource.VENDOR,
            "vendor_news",
            new DiscoveryCandidate(null, null, "Signatera coverage expanded", "summary", url, Relevance.HIGH, Map.of())
        );
        assertThat(added).isNotNull();

        mockMvc.perform(get("/api/pipeline/discoveries").param("source", "vendor"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.id == '" + added.id() + "')]").exists());

        mockMvc.perform(post("/api/pipeline/discoveries/" + added.id() + "/review")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notes\":\"ok\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("reviewed"))
            .andExpect(jsonPath("$.reviewNotes").value("ok"));

        mockMvc.perform(get("/api/pipeline/discoveries").param("source", "vendor"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.id == '" + added.id() + "')]").doesNotExist());
    }
}
