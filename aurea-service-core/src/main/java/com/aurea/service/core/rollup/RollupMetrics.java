package com.aurea.service.core.rollup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Metric extractors applied to every row of a rollup group. A null {@code revenue} contributes nothing; a null
 * {@code converted} predicate means conversion rates stay at zero.
 */
public record RollupMetrics<T>(
        ToDoubleFunction<T> revenue, Predicate<T> converted, Map<String, ToDoubleFunction<T>> sums) {

    public RollupMetrics {
        sums = sums == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sums));
    }

    public static <T> RollupMetrics<T> countOnly() {
        return new RollupMetrics<>(null, null, Map.of());
    }

    public static <T> RollupMetrics<T> of(ToDoubleFunction<T> revenue, Predicate<T> converted) {
        return new RollupMetrics<>(revenue, converted, Map.of());
    }

    public RollupMetrics<T> withSum(String name, ToDoubleFunction<T> extractor) {
        Map<String, ToDoubleFunction<T>> next = new LinkedHashMap<>(sums);
        next.put(name, extractor);
        return new RollupMetrics<>(revenue, converted, next);
    }
}
