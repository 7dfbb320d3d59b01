package com.openonco.discovery.pipeline.persistence;

import com.openonco.discovery.pipeline.model.Discovery;

import java.util.List;

/**
 * Whole-collection storage for discoveries. {@link #saveAll} replaces the stored collection
 * atomically or throws {@link PersistenceException} leaving it untouched.
 */
public interface DiscoveryRepository {
    List<Discovery> findAll();

    void saveAll(List<Discovery> discoveries);
}
