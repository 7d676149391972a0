package com.swipeengine.service.batch;

import com.swipeengine.model.Entity;
import lombok.Value;

import java.util.List;

/**
 * Everything gathered by one collection pass. {@code vectors} and
 * {@code entities} are parallel; {@code totalItems} also counts the
 * records that were skipped.
 */
@Value
public class CollectedBatch {
    float[][] vectors;
    List<Entity> entities;
    long totalItems;

    public int size() {
        return vectors.length;
    }

    public boolean isEmpty() {
        return vectors.length == 0;
    }

    public int getSkipped() {
        return (int) (totalItems - vectors.length);
    }
}
