package com.swipeengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Clustering result as handed to a persistence sink, keyed by entity type.
 */
@Value
@Builder
public class ClusteringRecord {
    EntityType entityType;
    List<Cluster> clusters;
    Map<String, String> assignments;
    double quality;
    ClusteringMetadata metadata;
    Instant createdAt;

    public static ClusteringRecord of(EntityType entityType, ClusteringResult result) {
        return ClusteringRecord.builder()
                .entityType(entityType)
                .clusters(result.getClusters())
                .assignments(result.getAssignments())
                .quality(result.getQuality())
                .metadata(result.getMetadata())
                .createdAt(Instant.now())
                .build();
    }

    public Optional<String> clusterOf(String entityId) {
        return Optional.ofNullable(assignments.get(entityId));
    }
}
