package com.swipeengine.repository;

import com.swipeengine.model.ClusteringRecord;
import com.swipeengine.model.EntityType;

import java.util.Optional;

/**
 * Sink that can also read back the latest result per entity type.
 */
public interface ClusteringResultStore extends ClusteringResultSink {

    Optional<ClusteringRecord> findLatest(EntityType entityType);
}
