package com.swipeengine.service.clustering;

import com.swipeengine.model.ClusteringRecord;
import com.swipeengine.model.EntityType;
import com.swipeengine.repository.ClusteringResultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read side of clustering: which cluster an entity currently belongs to.
 */
@Slf4j
@Service
public class ClusterAssignmentService {

    private final ClusteringResultStore store;

    public ClusterAssignmentService(ClusteringResultStore store) {
        this.store = store;
    }

    /**
     * Cluster of an entity in the most recent persisted result for its type.
     *
     * @return the cluster id, or empty for noise, unknown entities, or when
     *         no result has been persisted yet
     */
    public Optional<String> findClusterId(EntityType entityType, String entityId) {
        if (entityType == null || entityId == null) {
            throw new IllegalArgumentException("Entity type and id are required");
        }
        Optional<String> clusterId = findLatestResult(entityType)
                .flatMap(record -> record.clusterOf(entityId));
        log.debug("Cluster of {} {}: {}", entityType, entityId, clusterId.orElse("none"));
        return clusterId;
    }

    public Optional<ClusteringRecord> findLatestResult(EntityType entityType) {
        return store.findLatest(entityType);
    }
}
