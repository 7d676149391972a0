package com.swipeengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Totals reported by one embedding refresh pass.
 */
@Value
@Builder
public class RefreshSummary {
    EntityType entityType;
    int processed;
    int succeeded;
    int failed;
    long durationMs;
}
