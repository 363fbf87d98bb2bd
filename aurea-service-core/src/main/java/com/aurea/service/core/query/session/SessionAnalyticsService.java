package com.aurea.service.core.query.session;

import com.aurea.service.core.attribution.AttributionResolver;
import com.aurea.service.core.bucket.BucketGranularity;
import com.aurea.service.core.bucket.SeriesFill;
import com.aurea.service.core.bucket.SeriesMetric;
import com.aurea.service.core.bucket.TimeBucket;
import com.aurea.service.core.bucket.TimeBucketer;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.Geography;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.model.WebVitals;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.EventRepository;
import com.aurea.service.core.repo.SessionRepository;
import com.aurea.service.core.rollup.GroupRollup;
import com.aurea.service.core.rollup.RollupAggregator;
import com.aurea.service.core.rollup.RollupMetrics;
import com.aurea.service.core.support.Percentages;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Session-level analyses: trends, device and geography breakdowns, web vitals. */
@Service
public class SessionAnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(SessionAnalyticsService.class);

    static final int TOP_CITIES = 20;

    private final FunnelLookup funnelLookup;
    private final SessionRepository sessionRepository;
    private final EventRepository eventRepository;
    private final AttributionResolver attributionResolver;
    private final TimeBucketer bucketer;

    public SessionAnalyticsService(
            FunnelLookup funnelLookup,
            SessionRepository sessionRepository,
            EventRepository eventRepository,
            AttributionResolver attributionResolver,
            TimeBucketer bucketer) {
        this.funnelLookup = funnelLookup;
        this.sessionRepository = sessionRepository;
        this.eventRepository = eventRepository;
        this.attributionResolver = attributionResolver;
        this.bucketer = bucketer;
    }

    /** @param granularity null picks hourly buckets for windows up to 24h and daily beyond */
    public SessionsTrendResult sessionsTrend(UUID funnelId, TimeWindow window, BucketGranularity granularity) {
        return sessionsTrend(funnelId, window, granularity, SeriesFill.NONE);
    }

    /** @param fill {@link SeriesFill#ZERO} also returns the window's empty buckets */
    public SessionsTrendResult sessionsTrend(
            UUID funnelId, TimeWindow window, BucketGranularity granularity, SeriesFill fill) {
        funnelLookup.requireFunnel(funnelId);
        BucketGranularity effective = granularity == null ? BucketGranularity.trendDefault(window) : granularity;
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);

        List<SeriesMetric<FunnelSession>> metrics = List.of(
                SeriesMetric.count("sessions"),
                SeriesMetric.sum("pageViews", FunnelSession::pageViews),
                SeriesMetric.countIf("conversions", FunnelSession::converted),
                SeriesMetric.sum("revenue", FunnelSession::conversionValueOrZero),
                SeriesMetric.sum("duration", FunnelSession::durationOrZero),
                SeriesMetric.<FunnelSession>sum("score", s -> s.experienceScore() == null ? 0 : s.experienceScore()),
                SeriesMetric.<FunnelSession>countIf("scored", s -> s.experienceScore() != null));
        List<SessionsTrendResult.Point> points = new ArrayList<>();
        for (TimeBucket bucket :
                bucketer.aggregate(sessions, FunnelSession::startedAt, effective, metrics, fill, window)) {
            long count = bucket.count("sessions");
            points.add(new SessionsTrendResult.Point(
                    bucket.key(),
                    bucket.label(),
                    count,
                    bucket.count("pageViews"),
                    bucket.count("conversions"),
                    bucket.value("revenue"),
                    Math.round(Percentages.average(bucket.value("duration"), count)),
                    Math.round(Percentages.average(bucket.value("score"), bucket.count("scored")))));
        }

        Map<DurationBand, long[]> bands = new EnumMap<>(DurationBand.class);
        for (DurationBand band : DurationBand.values()) {
            bands.put(band, new long[1]);
        }
        long pageViews = 0;
        long duration = 0;
        long scoreTotal = 0;
        long scored = 0;
        long conversions = 0;
        double revenue = 0.0d;
        for (FunnelSession session : sessions) {
            DurationBand band = DurationBand.of(session.durationOrZero());
            if (band != null) {
                bands.get(band)[0]++;
            }
            pageViews += session.pageViews();
            duration += session.durationOrZero();
            if (session.experienceScore() != null) {
                scoreTotal += session.experienceScore();
                scored++;
            }
            if (session.converted()) {
                conversions++;
            }
            revenue += session.conversionValueOrZero();
        }
        List<SessionsTrendResult.DurationBucket> distribution = new ArrayList<>();
        bands.forEach((band, count) -> distribution.add(new SessionsTrendResult.DurationBucket(
                band.range(),
                band.minSeconds(),
                band == DurationBand.OVER_10M ? null : band.maxSeconds(),
                count[0])));

        return new SessionsTrendResult(
                List.copyOf(points),
                List.copyOf(distribution),
                effective.wireValue(),
                sessions.size(),
                conversions,
                revenue,
                Math.round(Percentages.average(pageViews, sessions.size())),
                Math.round(Percentages.average(duration, sessions.size())),
                Math.round(Percentages.average(scoreTotal, scored)));
    }

    public DeviceAnalyticsResult deviceAnalytics(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);
        RollupMetrics<FunnelSession> metrics = sessionMetrics();
        return new DeviceAnalyticsResult(
                deviceRows(RollupAggregator.rollup(sessions, s -> s.device().deviceType(), metrics)),
                deviceRows(RollupAggregator.rollup(sessions, s -> s.device().browserName(), metrics)),
                deviceRows(RollupAggregator.rollup(sessions, s -> s.device().osName(), metrics)),
                sessions.size(),
                sessions.stream().filter(FunnelSession::converted).count());
    }

    /**
     * Country and top city rollups. Sessions without a known country borrow the newest geography-bearing event of
     * the same session, read in one batch for all of them.
     */
    public GeographyAnalyticsResult geographyAnalytics(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);
        Set<String> missing = attributionResolver.sessionsNeedingGeoFallback(sessions);
        Map<String, Geography> fallbacks = missing.isEmpty()
                ? Map.of()
                : attributionResolver.latestPerSession(eventRepository.findGeoSightings(funnelId, window, missing));
        log.debug(
                "Geography funnel={} sessions={} fallbackNeeded={} fallbackFound={}",
                funnelId,
                sessions.size(),
                missing.size(),
                fallbacks.size());

        List<Located> located = new ArrayList<>(sessions.size());
        Map<String, String> countryNames = new LinkedHashMap<>();
        for (FunnelSession session : sessions) {
            Geography geography = attributionResolver.resolveGeography(session, fallbacks);
            countryNames.putIfAbsent(geography.countryCode(), geography.countryName());
            located.add(new Located(session, geography));
        }

        RollupMetrics<Located> metrics = RollupMetrics.<Located>of(
                        l -> l.session().conversionValueOrZero(), l -> l.session().converted())
                .withSum("pageViews", l -> l.session().pageViews());
        List<GeographyAnalyticsResult.CountryRow> countries = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.rollup(located, l -> l.geography().countryCode(), metrics)) {
            countries.add(new GeographyAnalyticsResult.CountryRow(
                    group.key(),
                    countryNames.getOrDefault(group.key(), group.key()),
                    group.count(),
                    group.conversions(),
                    group.revenue(),
                    Math.round(group.sum("pageViews")),
                    Percentages.round(group.percentage(), 1),
                    Percentages.round(group.conversionRate(), 1)));
        }

        List<Located> withCity =
                located.stream().filter(l -> l.geography().city() != null).toList();
        List<Function<Located, String>> cityKeys =
                List.of(l -> l.geography().city(), l -> l.geography().countryCode());
        List<GeographyAnalyticsResult.CityRow> cities = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.limit(
                RollupAggregator.rollupByMultipleKeys(withCity, cityKeys, metrics), TOP_CITIES)) {
            cities.add(new GeographyAnalyticsResult.CityRow(
                    group.dimension(0),
                    group.dimension(1),
                    countryNames.getOrDefault(group.dimension(1), group.dimension(1)),
                    group.count(),
                    group.conversions(),
                    Percentages.round(Percentages.percent(group.count(), sessions.size()), 1)));
        }

        return new GeographyAnalyticsResult(
                List.copyOf(countries),
                cities,
                sessions.size(),
                sessions.stream().filter(FunnelSession::converted).count(),
                sessions.stream().mapToDouble(FunnelSession::conversionValueOrZero).sum());
    }

    public PerformanceResult performance(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);

        VitalsAverager overall = new VitalsAverager();
        Map<String, VitalsAverager> byDevice = new LinkedHashMap<>();
        for (FunnelSession session : sessions) {
            overall.add(session);
            String device = session.device().deviceType() == null
                    ? RollupAggregator.UNKNOWN_KEY
                    : session.device().deviceType();
            byDevice.computeIfAbsent(device, k -> new VitalsAverager()).add(session);
        }

        List<PerformanceResult.DeviceRow> devices = new ArrayList<>(byDevice.size());
        byDevice.forEach((device, acc) -> devices.add(new PerformanceResult.DeviceRow(
                device,
                acc.average(WebVitals::lcp),
                acc.average(WebVitals::inp),
                acc.average(WebVitals::cls),
                acc.average(WebVitals::fcp),
                acc.average(WebVitals::ttfb),
                acc.averageScore(),
                acc.scored)));
        return new PerformanceResult(
                new PerformanceResult.Overall(
                        overall.average(WebVitals::lcp),
                        overall.average(WebVitals::inp),
                        overall.average(WebVitals::cls),
                        overall.average(WebVitals::fcp),
                        overall.average(WebVitals::ttfb),
                        overall.averageScore(),
                        sessions.size()),
                List.copyOf(devices));
    }

    private static RollupMetrics<FunnelSession> sessionMetrics() {
        return RollupMetrics.<FunnelSession>of(FunnelSession::conversionValueOrZero, FunnelSession::converted)
                .withSum("pageViews", FunnelSession::pageViews);
    }

    private static List<DeviceAnalyticsResult.Row> deviceRows(List<GroupRollup> groups) {
        List<DeviceAnalyticsResult.Row> rows = new ArrayList<>(groups.size());
        for (GroupRollup group : groups) {
            rows.add(new DeviceAnalyticsResult.Row(
                    group.key(),
                    group.count(),
                    group.conversions(),
                    group.revenue(),
                    Math.round(group.sum("pageViews")),
                    Percentages.round(group.percentage(), 1),
                    Percentages.round(group.conversionRate(), 1)));
        }
        return List.copyOf(rows);
    }

    private record Located(FunnelSession session, Geography geography) {}

    private static final class VitalsAverager {
        private final List<WebVitals> vitals = new ArrayList<>();
        private long scoreTotal;
        private long scored;

        void add(FunnelSession session) {
            vitals.add(session.vitals());
            if (session.experienceScore() != null) {
                scoreTotal += session.experienceScore();
                scored++;
            }
        }

        Double average(Function<WebVitals, Double> vital) {
            double total = 0.0d;
            long count = 0;
            for (WebVitals v : vitals) {
                Double value = vital.apply(v);
                if (value != null) {
                    total += value;
                    count++;
                }
            }
            return count == 0 ? null : total / count;
        }

        Long averageScore() {
            return scored == 0 ? null : Math.round((double) scoreTotal / scored);
        }
    }
}
