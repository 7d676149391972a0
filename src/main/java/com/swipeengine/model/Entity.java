package com.swipeengine.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Lightweight descriptor of a user or post taking part in a clustering run.
 * Identity is the (type, id) pair.
 */
@Value
@Builder
@Jacksonized
public class Entity {
    String id;
    EntityType type;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
