package com.aurea.service.core.bucket;

import java.time.Instant;
import java.util.Map;

/**
 * One bucket of a time series. {@code key} is the ISO-8601 bucket start and sorts chronologically.
 */
public record TimeBucket(String key, Instant start, String label, Map<String, Double> totals) {

    public double value(String metric) {
        Double value = totals.get(metric);
        return value == null ? 0.0d : value;
    }

    public long count(String metric) {
        return Math.round(value(metric));
    }
}
