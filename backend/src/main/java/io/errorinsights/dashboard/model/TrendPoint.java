package io.errorinsights.dashboard.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TrendPoint(Instant bucketStart, long count, Map<String, Long> breakdown) {

    public TrendPoint {
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
