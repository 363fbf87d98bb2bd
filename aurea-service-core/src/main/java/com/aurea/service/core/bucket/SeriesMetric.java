package com.aurea.service.core.bucket;

import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/** A named per-row contribution folded into every bucket. */
public record SeriesMetric<T>(String name, ToDoubleFunction<T> extractor) {

    public static <T> SeriesMetric<T> count(String name) {
        return new SeriesMetric<>(name, row -> 1.0d);
    }

    public static <T> SeriesMetric<T> sum(String name, ToDoubleFunction<T> extractor) {
        return new SeriesMetric<>(name, extractor);
    }

    public static <T> SeriesMetric<T> countIf(String name, Predicate<T> predicate) {
        return new SeriesMetric<>(name, row -> predicate.test(row) ? 1.0d : 0.0d);
    }
}
