package com.swipeengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kind of entity that owns an embedding.
 *
 * Serialized as the lowercase value ("user", "post") both in JSON and in the
 * entity_type column of persisted clustering results.
 */
public enum EntityType {

    USER("user", "users"),

    /**
     * Moments (content items) are called posts throughout the engine.
     */
    POST("post", "posts");

    private final String value;
    private final String collection;

    EntityType(String value, String collection) {
        this.value = value;
        this.collection = collection;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Plural path segment used by the embedding compute service.
     */
    public String getCollection() {
        return collection;
    }

    @JsonCreator
    public static EntityType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
