package com.swipeengine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What a forced batch run did: refresh totals and clustering results per
 * entity type, plus the steps that failed.
 */
@Value
@Builder
public class BatchRunReport {
    @Singular("refresh")
    Map<EntityType, RefreshSummary> refreshes;

    @Singular("clustering")
    Map<EntityType, ClusteringResult> clusterings;

    @Singular("failure")
    List<String> failures;

    public boolean isSuccessful() {
        return failures.isEmpty();
    }
}
