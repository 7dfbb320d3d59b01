package com.openonco.discovery.pipeline.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PriorityTest {

    @Test
    void deviceApprovalsAndHighRelevanceLead() {
        assertEquals(Priority.HIGH, Priority.infer(DiscoverySource.DEVICE_APPROVAL, "fda_approval", Relevance.LOW));
        assertEquals(Priority.HIGH, Priority.infer(DiscoverySource.VENDOR, "fda_approval", Relevance.LOW));
        assertEquals(Priority.HIGH, Priority.infer(DiscoverySource.PAYER, "payer_policy_new", Relevance.HIGH));
    }

    @Test
    void knownSourcesDefaultToMedium() {
        assertEquals(Priority.MEDIUM, Priority.infer(DiscoverySource.COVERAGE_REGISTRY, "coverage_change", Relevance.MEDIUM));
        assertEquals(Priority.MEDIUM, Priority.infer(DiscoverySource.VENDOR, "vendor_coverage_announcement", Relevance.LOW));
        assertEquals(Priority.MEDIUM, Priority.infer(DiscoverySource.LITERATURE, "publication", Relevance.LOW));
    }

    @Test
    void unknownSourceIsLow() {
        assertEquals(Priority.LOW, Priority.infer(null, "other", Relevance.MEDIUM));
    }

    @Test
    void sourceIdsResolveLeniently() {
        assertEquals(DiscoverySource.COVERAGE_REGISTRY, DiscoverySource.fromId("COVERAGE_REGISTRY"));
        assertEquals(DiscoverySource.DEVICE_APPROVAL, DiscoverySource.fromId(" device-approval "));
        assertEquals(null, DiscoverySource.fromId("rss"));
    }
}
