package com.swipeengine.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one cluster recalculation.
 *
 * Built fresh for every run and never modified afterwards. Noise entities
 * have no entry in {@code assignments}; every assigned cluster id refers to
 * an element of {@code clusters}.
 */
@Value
@Builder
@Jacksonized
public class ClusteringResult {
    List<Cluster> clusters;
    Map<String, String> assignments;
    double quality;
    boolean converged;
    int iterations;
    ClusteringMetadata metadata;

    /**
     * Zero-cluster result for a population with nothing to cluster.
     */
    public static ClusteringResult empty(EntityType entityType, long totalItems, Instant createdAt) {
        return ClusteringResult.builder()
                .clusters(List.of())
                .assignments(Map.of())
                .quality(0.0)
                .converged(true)
                .iterations(0)
                .metadata(ClusteringMetadata.builder()
                        .totalItems(totalItems)
                        .entityType(entityType)
                        .createdAt(createdAt)
                        .build())
                .build();
    }

    /**
     * Cluster id assigned to an entity, empty for noise or unknown ids.
     */
    public Optional<String> clusterOf(String entityId) {
        return Optional.ofNullable(assignments.get(entityId));
    }

    public boolean isEmpty() {
        return clusters.isEmpty();
    }
}
