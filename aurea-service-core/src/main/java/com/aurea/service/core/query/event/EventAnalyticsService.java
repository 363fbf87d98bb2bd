package com.aurea.service.core.query.event;

import com.aurea.service.core.bucket.BucketGranularity;
import com.aurea.service.core.bucket.SeriesFill;
import com.aurea.service.core.bucket.SeriesMetric;
import com.aurea.service.core.bucket.TimeBucket;
import com.aurea.service.core.bucket.TimeBucketer;
import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.EventFilter;
import com.aurea.service.core.repo.EventRepository;
import com.aurea.service.core.rollup.GroupRollup;
import com.aurea.service.core.rollup.RollupAggregator;
import com.aurea.service.core.rollup.RollupMetrics;
import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Time-shaped event analyses. */
@Service
public class EventAnalyticsService {
    static final int TOP_EVENT_TYPES = 20;
    static final String CONVERSION_CATEGORY = "conversion";

    private final FunnelLookup funnelLookup;
    private final EventRepository eventRepository;
    private final TimeBucketer bucketer;

    public EventAnalyticsService(FunnelLookup funnelLookup, EventRepository eventRepository, TimeBucketer bucketer) {
        this.funnelLookup = funnelLookup;
        this.eventRepository = eventRepository;
        this.bucketer = bucketer;
    }

    /** @param granularity null picks hourly buckets for windows up to 24h and daily beyond */
    public EventsTrendResult eventsTrend(UUID funnelId, TimeWindow window, BucketGranularity granularity) {
        return eventsTrend(funnelId, window, granularity, SeriesFill.NONE);
    }

    /** @param fill {@link SeriesFill#ZERO} also returns the window's empty buckets */
    public EventsTrendResult eventsTrend(
            UUID funnelId, TimeWindow window, BucketGranularity granularity, SeriesFill fill) {
        funnelLookup.requireFunnel(funnelId);
        BucketGranularity effective = granularity == null ? BucketGranularity.trendDefault(window) : granularity;
        List<FunnelEvent> events = eventRepository.findInWindow(funnelId, window, EventFilter.all());

        List<SeriesMetric<FunnelEvent>> metrics = List.of(
                SeriesMetric.count("total"),
                SeriesMetric.countIf("pageViews", FunnelEvent::pageView),
                SeriesMetric.<FunnelEvent>countIf("custom", e -> !e.pageView()),
                SeriesMetric.countIf("conversions", FunnelEvent::conversion),
                SeriesMetric.sum("revenue", FunnelEvent::revenueOrZero));
        List<EventsTrendResult.Point> points = new ArrayList<>();
        for (TimeBucket bucket : bucketer.aggregate(events, FunnelEvent::timestamp, effective, metrics, fill, window)) {
            points.add(new EventsTrendResult.Point(
                    bucket.key(),
                    bucket.label(),
                    bucket.count("total"),
                    bucket.count("pageViews"),
                    bucket.count("custom"),
                    bucket.count("conversions"),
                    bucket.value("revenue")));
        }

        Map<String, String> firstCategory = new HashMap<>();
        for (FunnelEvent event : events) {
            if (!firstCategory.containsKey(event.eventName())) {
                firstCategory.put(event.eventName(), blankToNull(event.eventCategory()));
            }
        }
        List<EventsTrendResult.EventType> eventTypes = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.limit(
                RollupAggregator.rollup(events, FunnelEvent::eventName, RollupMetrics.countOnly()), TOP_EVENT_TYPES)) {
            eventTypes.add(new EventsTrendResult.EventType(group.key(), group.count(), firstCategory.get(group.key())));
        }

        return new EventsTrendResult(
                List.copyOf(points),
                List.copyOf(eventTypes),
                effective.wireValue(),
                events.size(),
                events.stream().filter(FunnelEvent::conversion).count(),
                events.stream().mapToDouble(FunnelEvent::revenueOrZero).sum());
    }

    /** @param granularity null means 4-hour buckets */
    public EventsOverTimeResult eventsOverTime(UUID funnelId, TimeWindow window, BucketGranularity granularity) {
        return eventsOverTime(funnelId, window, granularity, SeriesFill.NONE);
    }

    public EventsOverTimeResult eventsOverTime(
            UUID funnelId, TimeWindow window, BucketGranularity granularity, SeriesFill fill) {
        funnelLookup.requireFunnel(funnelId);
        BucketGranularity effective = granularity == null ? BucketGranularity.H4 : granularity;
        List<FunnelEvent> events = eventRepository.findInWindow(funnelId, window, EventFilter.all());
        List<SeriesMetric<FunnelEvent>> metrics =
                List.of(SeriesMetric.count("events"), SeriesMetric.countIf("conversions", FunnelEvent::conversion));
        List<EventsOverTimeResult.Point> points = new ArrayList<>();
        for (TimeBucket bucket : bucketer.aggregate(events, FunnelEvent::timestamp, effective, metrics, fill, window)) {
            points.add(new EventsOverTimeResult.Point(
                    bucket.key(), bucket.label(), bucket.count("events"), bucket.count("conversions")));
        }
        return new EventsOverTimeResult(
                events.size(),
                events.stream().filter(FunnelEvent::conversion).count(),
                effective.wireValue(),
                List.copyOf(points));
    }

    /**
     * Per bucket event counts by category. Conversion events count under {@code conversion} whatever their own
     * category.
     *
     * @param granularity null means 4-hour buckets
     */
    public CategoryTrendResult categoryTrend(UUID funnelId, TimeWindow window, BucketGranularity granularity) {
        funnelLookup.requireFunnel(funnelId);
        BucketGranularity effective = granularity == null ? BucketGranularity.H4 : granularity;
        List<FunnelEvent> events = eventRepository.findInWindow(funnelId, window, EventFilter.all());

        List<TimeBucket> buckets = bucketer.aggregateByDimension(
                events, FunnelEvent::timestamp, effective, EventAnalyticsService::trendCategory);
        TreeSet<String> categories = new TreeSet<>();
        List<CategoryTrendResult.Point> points = new ArrayList<>(buckets.size());
        for (TimeBucket bucket : buckets) {
            Map<String, Long> counts = new LinkedHashMap<>();
            bucket.totals().forEach((category, value) -> counts.put(category, Math.round(value)));
            categories.addAll(counts.keySet());
            points.add(new CategoryTrendResult.Point(bucket.key(), bucket.label(), counts));
        }
        return new CategoryTrendResult(
                events.size(), effective.wireValue(), List.copyOf(points), List.copyOf(categories));
    }

    /** Day-of-week by hour grid of conversion events in the bucketer's zone. */
    public PurchaseHeatmapResult purchaseHeatmap(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelEvent> conversions = eventRepository.findInWindow(funnelId, window, EventFilter.conversions());

        long[][] counts = new long[7][24];
        double[][] revenue = new double[7][24];
        double totalRevenue = 0.0d;
        for (FunnelEvent event : conversions) {
            if (event.timestamp() == null) {
                continue;
            }
            ZonedDateTime zdt = event.timestamp().atZone(bucketer.zone());
            int day = dayIndex(zdt.getDayOfWeek());
            counts[day][zdt.getHour()]++;
            revenue[day][zdt.getHour()] += event.revenueOrZero();
            totalRevenue += event.revenueOrZero();
        }

        long max = 0;
        int peakDay = 0;
        int peakHour = 0;
        List<PurchaseHeatmapResult.Day> days = new ArrayList<>(7);
        for (int day = 0; day < 7; day++) {
            List<PurchaseHeatmapResult.Hour> hours = new ArrayList<>(24);
            for (int hour = 0; hour < 24; hour++) {
                if (counts[day][hour] > max) {
                    max = counts[day][hour];
                    peakDay = day;
                    peakHour = hour;
                }
                hours.add(new PurchaseHeatmapResult.Hour(hour, counts[day][hour], revenue[day][hour]));
            }
            days.add(new PurchaseHeatmapResult.Day(dayName(day), day, List.copyOf(hours)));
        }
        PurchaseHeatmapResult.Peak peak = new PurchaseHeatmapResult.Peak(
                dayName(peakDay), peakDay, peakHour, max, revenue[peakDay][peakHour]);
        return new PurchaseHeatmapResult(List.copyOf(days), conversions.size(), totalRevenue, peak, max);
    }

    static String trendCategory(FunnelEvent event) {
        return event.conversion() ? CONVERSION_CATEGORY : event.categoryOrDefault();
    }

    /** Sunday is 0, Saturday is 6. */
    static int dayIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    private static String dayName(int dayIndex) {
        DayOfWeek dayOfWeek = dayIndex == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(dayIndex);
        return dayOfWeek.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
