package com.aurea.service.core.rollup;

import com.aurea.service.core.support.Percentages;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Generic group-by/sum/percentage primitive shared by every breakdown dimension.
 *
 * <p>Groups come out ordered by count descending. The sort is stable, so ties keep the order in which their key was
 * first encountered in the input.
 */
public final class RollupAggregator {

    public static final String UNKNOWN_KEY = "Unknown";

    private RollupAggregator() {}

    public static <T> List<GroupRollup> rollup(
            Collection<T> rows, Function<T, String> keyFn, RollupMetrics<T> metrics) {
        return rollupByMultipleKeys(rows, List.of(keyFn), metrics);
    }

    public static <T> List<GroupRollup> rollupByMultipleKeys(
            Collection<T> rows, List<Function<T, String>> keyFns, RollupMetrics<T> metrics) {
        if (keyFns == null || keyFns.isEmpty()) {
            throw new IllegalArgumentException("At least one key extractor is required");
        }
        Map<List<String>, Accumulator> groups = new LinkedHashMap<>();
        for (T row : rows) {
            List<String> key = new ArrayList<>(keyFns.size());
            for (Function<T, String> keyFn : keyFns) {
                String part = keyFn.apply(row);
                key.add(part == null ? UNKNOWN_KEY : part);
            }
            groups.computeIfAbsent(List.copyOf(key), k -> new Accumulator()).add(row, metrics);
        }
        long total = rows.size();
        List<GroupRollup> out = new ArrayList<>(groups.size());
        for (Map.Entry<List<String>, Accumulator> entry : groups.entrySet()) {
            out.add(entry.getValue().toRollup(entry.getKey(), total));
        }
        out.sort(Comparator.comparingLong(GroupRollup::count).reversed());
        return out;
    }

    /**
     * Ad-hoc breakdown over dynamic keys: first discovers every key present in the rows, then rolls the rows up per
     * key by the value the extractor returns for that key. Keys keep discovery order.
     */
    public static <T> Map<String, List<GroupRollup>> groupBy(
            Collection<T> rows,
            Function<T, Collection<String>> keyDiscovery,
            BiFunction<T, String, String> valueExtractor,
            RollupMetrics<T> metrics) {
        Set<String> keys = new LinkedHashSet<>();
        for (T row : rows) {
            Collection<String> discovered = keyDiscovery.apply(row);
            if (discovered != null) {
                keys.addAll(discovered);
            }
        }
        Map<String, List<GroupRollup>> out = new LinkedHashMap<>();
        for (String key : keys) {
            out.put(key, rollup(rows, row -> valueExtractor.apply(row, key), metrics));
        }
        return out;
    }

    public static <E> List<E> limit(List<E> items, int limit) {
        if (limit <= 0 || items.size() <= limit) {
            return items;
        }
        return List.copyOf(items.subList(0, limit));
    }

    private static final class Accumulator {
        private long count;
        private long conversions;
        private double revenue;
        private final Map<String, Double> sums = new LinkedHashMap<>();

        <T> void add(T row, RollupMetrics<T> metrics) {
            count++;
            if (metrics.converted() != null && metrics.converted().test(row)) {
                conversions++;
            }
            if (metrics.revenue() != null) {
                revenue += metrics.revenue().applyAsDouble(row);
            }
            for (Map.Entry<String, ToDoubleFunction<T>> sum : metrics.sums().entrySet()) {
                sums.merge(sum.getKey(), sum.getValue().applyAsDouble(row), Double::sum);
            }
        }

        GroupRollup toRollup(List<String> key, long total) {
            return new GroupRollup(
                    key,
                    count,
                    conversions,
                    revenue,
                    Percentages.percent(count, total),
                    Percentages.percent(conversions, count),
                    Collections.unmodifiableMap(new LinkedHashMap<>(sums)));
        }
    }
}
