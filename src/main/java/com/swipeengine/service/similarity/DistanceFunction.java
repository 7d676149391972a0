package com.swipeengine.service.similarity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Distance measures supported by the clustering engine.
 */
public enum DistanceFunction {

    /**
     * L2 norm of the difference.
     */
    EUCLIDEAN,

    /**
     * 1 - cosine similarity, in [0, 2]. Maximal (1.0) when either vector is zero.
     */
    COSINE,

    /**
     * L1 norm of the difference.
     */
    MANHATTAN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DistanceFunction fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
