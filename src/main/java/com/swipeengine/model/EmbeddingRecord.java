package com.swipeengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One row handed out by an embedding source.
 * The vector may be null or empty when the entity has not been embedded yet.
 */
@Value
@Builder
public class EmbeddingRecord {
    String entityId;
    float[] vector;
    Map<String, Object> metadata;

    /**
     * Check if the record carries a usable vector.
     */
    public boolean hasVector() {
        return vector != null && vector.length > 0;
    }
}
