package com.swipeengine.repository;

import com.swipeengine.model.ClusteringRecord;

/**
 * Durable destination for clustering results.
 */
public interface ClusteringResultSink {

    /**
     * Store a clustering result. Throws on failure.
     */
    void saveClusteringResult(ClusteringRecord record);
}
