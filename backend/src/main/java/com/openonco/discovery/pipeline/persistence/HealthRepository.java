package com.openonco.discovery.pipeline.persistence;

import com.openonco.discovery.pipeline.model.HealthRecord;

import java.util.Map;

public interface HealthRepository {
    /**
     * Health records keyed by source id.
     */
    Map<String, HealthRecord> findAll();

    void saveAll(Map<String, HealthRecord> records);
}
