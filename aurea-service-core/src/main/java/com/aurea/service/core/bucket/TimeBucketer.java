package com.aurea.service.core.bucket;

import com.aurea.service.core.model.TimeWindow;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Maps timestamps to bucket keys and folds rows into ordered series.
 */
public class TimeBucketer {

    private static final DateTimeFormatter ISO_INSTANT = DateTimeFormatter.ISO_INSTANT;
    private static final DateTimeFormatter MINUTE_LABEL =
            DateTimeFormatter.ofPattern("MMM d H:mm", Locale.ENGLISH);
    private static final DateTimeFormatter DAY_LABEL = DateTimeFormatter.ofPattern("MMM d", Locale.ENGLISH);

    private final ZoneId zone;

    public TimeBucketer(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static TimeBucketer utc() {
        return new TimeBucketer(ZoneOffset.UTC);
    }

    public ZoneId zone() {
        return zone;
    }

    public Instant bucketStart(Instant timestamp, BucketGranularity granularity) {
        return granularity.align(timestamp.atZone(zone)).toInstant();
    }

    public String bucketKey(Instant timestamp, BucketGranularity granularity) {
        return ISO_INSTANT.format(bucketStart(timestamp, granularity));
    }

    public String label(Instant bucketStart, BucketGranularity granularity) {
        ZonedDateTime zdt = bucketStart.atZone(zone);
        return granularity == BucketGranularity.D1 ? DAY_LABEL.format(zdt) : MINUTE_LABEL.format(zdt);
    }

    /** Sparse series: only buckets that received at least one row. */
    public <T> List<TimeBucket> aggregate(
            Collection<T> rows,
            Function<T, Instant> timestampFn,
            BucketGranularity granularity,
            List<SeriesMetric<T>> metrics) {
        return fold(rows, timestampFn, granularity, metrics, Collections.emptyList());
    }

    /** Dense series: every bucket between the window bounds, empty ones zeroed. */
    public <T> List<TimeBucket> aggregateZeroFilled(
            Collection<T> rows,
            Function<T, Instant> timestampFn,
            BucketGranularity granularity,
            List<SeriesMetric<T>> metrics,
            TimeWindow window) {
        return fold(rows, timestampFn, granularity, metrics, bucketStarts(window, granularity));
    }

    /** Sparse or dense series over {@code window} depending on {@code fill}; null means {@link SeriesFill#NONE}. */
    public <T> List<TimeBucket> aggregate(
            Collection<T> rows,
            Function<T, Instant> timestampFn,
            BucketGranularity granularity,
            List<SeriesMetric<T>> metrics,
            SeriesFill fill,
            TimeWindow window) {
        return fill == SeriesFill.ZERO
                ? aggregateZeroFilled(rows, timestampFn, granularity, metrics, window)
                : aggregate(rows, timestampFn, granularity, metrics);
    }

    /**
     * Counts rows per bucket and per dimension value. Every bucket carries every dimension seen anywhere in the
     * series so that consumers get rectangular data.
     */
    public <T> List<TimeBucket> aggregateByDimension(
            Collection<T> rows,
            Function<T, Instant> timestampFn,
            BucketGranularity granularity,
            Function<T, String> dimensionFn) {
        TreeMap<Instant, Map<String, Double>> buckets = new TreeMap<>();
        TreeSet<String> dimensions = new TreeSet<>();
        for (T row : rows) {
            Instant ts = timestampFn.apply(row);
            if (ts == null) {
                continue;
            }
            String dimension = dimensionFn.apply(row);
            dimensions.add(dimension);
            buckets.computeIfAbsent(bucketStart(ts, granularity), k -> new LinkedHashMap<>())
                    .merge(dimension, 1.0d, Double::sum);
        }
        List<TimeBucket> out = new ArrayList<>(buckets.size());
        for (Map.Entry<Instant, Map<String, Double>> entry : buckets.entrySet()) {
            Map<String, Double> totals = new LinkedHashMap<>();
            for (String dimension : dimensions) {
                totals.put(dimension, entry.getValue().getOrDefault(dimension, 0.0d));
            }
            out.add(toBucket(entry.getKey(), granularity, totals));
        }
        return out;
    }

    public List<Instant> bucketStarts(TimeWindow window, BucketGranularity granularity) {
        List<Instant> starts = new ArrayList<>();
        ZonedDateTime cursor = granularity.align(window.from().atZone(zone));
        while (!cursor.toInstant().isAfter(window.to())) {
            starts.add(cursor.toInstant());
            cursor = granularity.next(cursor);
        }
        return starts;
    }

    private <T> List<TimeBucket> fold(
            Collection<T> rows,
            Function<T, Instant> timestampFn,
            BucketGranularity granularity,
            List<SeriesMetric<T>> metrics,
            List<Instant> prefilled) {
        TreeMap<Instant, Map<String, Double>> buckets = new TreeMap<>();
        for (Instant start : prefilled) {
            buckets.put(start, emptyTotals(metrics));
        }
        for (T row : rows) {
            Instant ts = timestampFn.apply(row);
            if (ts == null) {
                continue;
            }
            Map<String, Double> totals = buckets.computeIfAbsent(bucketStart(ts, granularity), k -> emptyTotals(metrics));
            for (SeriesMetric<T> metric : metrics) {
                totals.merge(metric.name(), metric.extractor().applyAsDouble(row), Double::sum);
            }
        }
        List<TimeBucket> out = new ArrayList<>(buckets.size());
        for (Map.Entry<Instant, Map<String, Double>> entry : buckets.entrySet()) {
            out.add(toBucket(entry.getKey(), granularity, entry.getValue()));
        }
        return out;
    }

    private TimeBucket toBucket(Instant start, BucketGranularity granularity, Map<String, Double> totals) {
        return new TimeBucket(
                ISO_INSTANT.format(start),
                start,
                label(start, granularity),
                Collections.unmodifiableMap(new LinkedHashMap<>(totals)));
    }

    private static <T> Map<String, Double> emptyTotals(List<SeriesMetric<T>> metrics) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (SeriesMetric<T> metric : metrics) {
            totals.put(metric.name(), 0.0d);
        }
        return totals;
    }
}
