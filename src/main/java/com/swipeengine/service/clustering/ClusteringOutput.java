package com.swipeengine.service.clustering;

import com.swipeengine.model.Cluster;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Raw partition produced by the clustering algorithm, before run metadata
 * and quality scoring are attached.
 */
@Value
@Builder
public class ClusteringOutput {
    List<Cluster> clusters;
    Map<String, String> assignments;
    int noiseCount;

    public static ClusteringOutput empty() {
        return ClusteringOutput.builder()
                .clusters(List.of())
                .assignments(Map.of())
                .noiseCount(0)
                .build();
    }
}
