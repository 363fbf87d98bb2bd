package com.aurea.service.core.query.traffic;

import com.aurea.service.core.attribution.AdPlatform;
import com.aurea.service.core.attribution.AttributionResolver;
import com.aurea.service.core.attribution.TouchResolution;
import com.aurea.service.core.attribution.TouchSide;
import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.EventFilter;
import com.aurea.service.core.repo.EventRepository;
import com.aurea.service.core.repo.SessionRepository;
import com.aurea.service.core.rollup.GroupRollup;
import com.aurea.service.core.rollup.RollupAggregator;
import com.aurea.service.core.rollup.RollupMetrics;
import com.aurea.service.core.support.Percentages;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Acquisition analyses: where sessions come from and which touches convert. */
@Service
public class TrafficAnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(TrafficAnalyticsService.class);

    static final int OVERVIEW_TOP_SOURCES = 10;
    static final int TOP_CAMPAIGNS = 10;
    static final String DIRECT = "Direct";
    static final String NONE = "None";
    static final String UNKNOWN_PLATFORM = "unknown";

    private final FunnelLookup funnelLookup;
    private final SessionRepository sessionRepository;
    private final EventRepository eventRepository;
    private final AttributionResolver attributionResolver;

    public TrafficAnalyticsService(
            FunnelLookup funnelLookup,
            SessionRepository sessionRepository,
            EventRepository eventRepository,
            AttributionResolver attributionResolver) {
        this.funnelLookup = funnelLookup;
        this.sessionRepository = sessionRepository;
        this.eventRepository = eventRepository;
        this.attributionResolver = attributionResolver;
    }

    public OverviewResult overview(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelEvent> events = eventRepository.findInWindow(funnelId, window, EventFilter.all());
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);

        long pageViews = events.stream().filter(FunnelEvent::pageView).count();
        long conversions = events.stream().filter(FunnelEvent::conversion).count();
        double revenue = events.stream()
                .filter(FunnelEvent::conversion)
                .mapToDouble(FunnelEvent::revenueOrZero)
                .sum();

        long ended = 0;
        long endedMillis = 0;
        for (FunnelSession session : sessions) {
            if (session.endedAt() != null && session.startedAt() != null) {
                ended++;
                endedMillis += Duration.between(session.startedAt(), session.endedAt()).toMillis();
            }
        }

        List<Function<FunnelEvent, String>> keys = List.of(
                e -> present(e.utmSource()) ? e.utmSource() : DIRECT,
                e -> present(e.utmMedium()) ? e.utmMedium() : "",
                e -> present(e.utmCampaign()) ? e.utmCampaign() : "");
        List<OverviewResult.UtmCombination> combos = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.limit(
                RollupAggregator.rollupByMultipleKeys(events, keys, RollupMetrics.countOnly()),
                OVERVIEW_TOP_SOURCES)) {
            combos.add(new OverviewResult.UtmCombination(
                    DIRECT.equals(group.dimension(0)) ? null : group.dimension(0),
                    emptyToNull(group.dimension(1)),
                    emptyToNull(group.dimension(2)),
                    group.count()));
        }

        OverviewResult.Stats stats = new OverviewResult.Stats(
                events.size(),
                sessions.size(),
                pageViews,
                conversions,
                revenue,
                Percentages.average(endedMillis, ended));
        return new OverviewResult(stats, List.copyOf(combos));
    }

    /** First-touch groups by session count; ties keep the order of their earliest session. */
    public TrafficSourcesResult trafficSources(UUID funnelId, TimeWindow window, int limit) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);
        List<Function<FunnelSession, String>> keys = List.of(
                TrafficAnalyticsService::source, TrafficAnalyticsService::medium, TrafficAnalyticsService::campaign);
        RollupMetrics<FunnelSession> metrics = RollupMetrics.of(FunnelSession::conversionValueOrZero, null);
        List<TrafficSourcesResult.Row> rows = new ArrayList<>();
        for (GroupRollup group :
                RollupAggregator.limit(RollupAggregator.rollupByMultipleKeys(sessions, keys, metrics), limit)) {
            rows.add(new TrafficSourcesResult.Row(
                    group.dimension(0), group.dimension(1), group.dimension(2), group.count(), group.revenue()));
        }
        return new TrafficSourcesResult(List.copyOf(rows));
    }

    public UtmAnalyticsResult utmAnalytics(UUID funnelId, TimeWindow window, UtmGroupBy groupBy) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);

        List<Function<FunnelSession, String>> keys = switch (groupBy) {
            case SOURCE -> List.of(TrafficAnalyticsService::source);
            case MEDIUM -> List.of(TrafficAnalyticsService::medium);
            case CAMPAIGN -> List.of(TrafficAnalyticsService::campaign);
            case ALL -> List.of(
                    TrafficAnalyticsService::source, TrafficAnalyticsService::medium, TrafficAnalyticsService::campaign);
        };
        RollupMetrics<FunnelSession> metrics = RollupMetrics.<FunnelSession>of(
                        FunnelSession::conversionValueOrZero, FunnelSession::converted)
                .withSum("pageViews", FunnelSession::pageViews);

        List<UtmAnalyticsResult.Row> rows = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.rollupByMultipleKeys(sessions, keys, metrics)) {
            rows.add(new UtmAnalyticsResult.Row(
                    dimensionFor(groupBy, UtmGroupBy.SOURCE, group, 0),
                    dimensionFor(groupBy, UtmGroupBy.MEDIUM, group, 1),
                    dimensionFor(groupBy, UtmGroupBy.CAMPAIGN, group, 2),
                    group.count(),
                    group.conversions(),
                    Percentages.round(group.conversionRate(), 2),
                    group.revenue(),
                    Percentages.round(group.average("pageViews"), 2),
                    Percentages.round(Percentages.average(group.revenue(), group.count()), 2),
                    Percentages.round(Percentages.average(group.revenue(), group.conversions()), 2)));
        }

        long converted = sessions.stream().filter(FunnelSession::converted).count();
        double revenue = sessions.stream()
                .mapToDouble(FunnelSession::conversionValueOrZero)
                .sum();
        UtmAnalyticsResult.Totals totals = new UtmAnalyticsResult.Totals(
                sessions.size(), converted, revenue, Percentages.round(Percentages.percent(converted, sessions.size()), 2));
        return new UtmAnalyticsResult(List.copyOf(rows), totals, groupBy.wireValue());
    }

    public AttributionResult attribution(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> converted = sessionRepository.findConvertedInWindow(funnelId, window);

        Map<AdPlatform, double[]> firstSplit = emptySplit();
        Map<AdPlatform, double[]> lastSplit = emptySplit();
        for (FunnelSession session : converted) {
            double value = session.conversionValueOrZero();
            tally(firstSplit, attributionResolver.resolveTouch(session, TouchSide.FIRST), value);
            tally(lastSplit, attributionResolver.resolveTouch(session, TouchSide.LAST), value);
        }

        RollupMetrics<FunnelSession> platformMetrics = RollupMetrics.<FunnelSession>of(
                        FunnelSession::conversionValueOrZero, null)
                .withSum("firstTouch", s -> attributed(s, TouchSide.FIRST))
                .withSum("lastTouch", s -> attributed(s, TouchSide.LAST));
        List<AttributionResult.PlatformRow> platforms = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.rollup(converted, TrafficAnalyticsService::platform, platformMetrics)) {
            platforms.add(new AttributionResult.PlatformRow(
                    group.key(),
                    group.count(),
                    group.revenue(),
                    Math.round(group.sum("firstTouch")),
                    Math.round(group.sum("lastTouch")),
                    Percentages.average(group.revenue(), group.count())));
        }
        platforms.sort(Comparator.comparingDouble(AttributionResult.PlatformRow::revenue).reversed());

        List<Function<FunnelSession, String>> campaignKeys =
                List.of(TrafficAnalyticsService::platform, TrafficAnalyticsService::attributedCampaign);
        RollupMetrics<FunnelSession> revenueOnly = RollupMetrics.of(FunnelSession::conversionValueOrZero, null);
        List<AttributionResult.CampaignRow> campaigns = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.rollupByMultipleKeys(converted, campaignKeys, revenueOnly)) {
            campaigns.add(new AttributionResult.CampaignRow(
                    group.dimension(0), group.dimension(1), group.count(), group.revenue()));
        }
        campaigns.sort(Comparator.comparingDouble(AttributionResult.CampaignRow::revenue).reversed());

        double totalRevenue = converted.stream()
                .mapToDouble(FunnelSession::conversionValueOrZero)
                .sum();
        log.debug("Attribution funnel={} conversions={} platforms={}", funnelId, converted.size(), platforms.size());
        return new AttributionResult(
                new AttributionResult.Summary(
                        converted.size(), totalRevenue, Percentages.average(totalRevenue, converted.size())),
                List.copyOf(platforms),
                RollupAggregator.limit(List.copyOf(campaigns), TOP_CAMPAIGNS),
                toSplit(firstSplit),
                toSplit(lastSplit));
    }

    private double attributed(FunnelSession session, TouchSide side) {
        return attributionResolver.resolveTouch(session, side).attributed() ? 1.0d : 0.0d;
    }

    private static Map<AdPlatform, double[]> emptySplit() {
        Map<AdPlatform, double[]> split = new EnumMap<>(AdPlatform.class);
        for (AdPlatform platform : AdPlatform.values()) {
            split.put(platform, new double[2]);
        }
        return split;
    }

    private static void tally(Map<AdPlatform, double[]> split, TouchResolution resolution, double value) {
        double[] cell = split.get(resolution.platform());
        cell[0]++;
        cell[1] += value;
    }

    private static List<AttributionResult.ChannelSplit> toSplit(Map<AdPlatform, double[]> split) {
        List<AttributionResult.ChannelSplit> out = new ArrayList<>(split.size());
        split.forEach((platform, cell) -> out.add(
                new AttributionResult.ChannelSplit(platform, platform.channel(), Math.round(cell[0]), cell[1])));
        return List.copyOf(out);
    }

    private static String dimensionFor(UtmGroupBy requested, UtmGroupBy dimension, GroupRollup group, int allIndex) {
        if (requested == UtmGroupBy.ALL) {
            return group.dimension(allIndex);
        }
        return requested == dimension ? group.key() : null;
    }

    static String source(FunnelSession session) {
        return present(session.firstTouch().source()) ? session.firstTouch().source() : DIRECT;
    }

    static String medium(FunnelSession session) {
        return present(session.firstTouch().medium()) ? session.firstTouch().medium() : NONE;
    }

    static String campaign(FunnelSession session) {
        return present(session.firstTouch().campaign()) ? session.firstTouch().campaign() : NONE;
    }

    static String platform(FunnelSession session) {
        return present(session.conversionPlatform()) ? session.conversionPlatform() : UNKNOWN_PLATFORM;
    }

    static String attributedCampaign(FunnelSession session) {
        if (present(session.lastTouch().campaign())) {
            return session.lastTouch().campaign();
        }
        return present(session.firstTouch().campaign()) ? session.firstTouch().campaign() : UNKNOWN_PLATFORM;
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
