package com.swipeengine.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A density-connected group of entities found by one clustering run.
 * The id is only meaningful within the run that produced it.
 */
@Value
@Builder
@Jacksonized
public class Cluster {
    String id;
    String name;
    float[] centroid;
    int size;
    double density;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Copy of the centroid, so the cluster stays unchanged once built.
     */
    public float[] getCentroid() {
        return centroid == null ? null : centroid.clone();
    }

    public static class ClusterBuilder {

        public ClusterBuilder centroid(float[] centroid) {
            this.centroid = centroid == null ? null : centroid.clone();
            return this;
        }
    }
}
