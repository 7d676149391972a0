package com.swipeengine.service.clustering;

import com.swipeengine.service.similarity.DistanceFunction;
import lombok.Builder;
import lombok.Value;

/**
 * DBSCAN parameters.
 */
@Value
@Builder(toBuilder = true)
public class DbscanConfig {

    /**
     * Neighborhood radius, in units of the distance function.
     */
    @Builder.Default
    double epsilon = 0.3;

    /**
     * Minimum neighborhood size (the point itself included) for a core point.
     */
    @Builder.Default
    int minPoints = 5;

    @Builder.Default
    DistanceFunction distanceFunction = DistanceFunction.COSINE;

    public static DbscanConfig defaults() {
        return DbscanConfig.builder().build();
    }

    /**
     * Fail fast on parameters that cannot produce a meaningful partition.
     */
    public DbscanConfig validate() {
        if (!(epsilon > 0.0) || Double.isInfinite(epsilon)) {
            throw new IllegalArgumentException("epsilon must be a positive finite number, got " + epsilon);
        }
        if (minPoints < 1) {
            throw new IllegalArgumentException("minPoints must be at least 1, got " + minPoints);
        }
        if (distanceFunction == null) {
            throw new IllegalArgumentException("distanceFunction is required");
        }
        return this;
    }
}
