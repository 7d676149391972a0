package com.swipeengine.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Run metadata attached to every clustering result.
 */
@Value
@Builder
@Jacksonized
public class ClusteringMetadata {

    /**
     * Every record read from the source, malformed ones included.
     */
    long totalItems;

    EntityType entityType;

    Instant createdAt;
}
