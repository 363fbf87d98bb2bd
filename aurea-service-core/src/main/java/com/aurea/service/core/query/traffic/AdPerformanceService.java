package com.aurea.service.core.query.traffic;

import com.aurea.service.core.bucket.BucketGranularity;
import com.aurea.service.core.bucket.TimeBucket;
import com.aurea.service.core.bucket.TimeBucketer;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.model.TouchAttribution;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.SessionRepository;
import com.aurea.service.core.rollup.GroupRollup;
import com.aurea.service.core.rollup.RollupAggregator;
import com.aurea.service.core.rollup.RollupMetrics;
import com.aurea.service.core.support.Percentages;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Conversion revenue per ad platform with each platform's best campaigns and a daily conversion timeline. */
@Service
public class AdPerformanceService {
    private static final Logger log = LoggerFactory.getLogger(AdPerformanceService.class);

    static final int TOP_CAMPAIGNS_PER_PLATFORM = 5;

    private static final Comparator<GroupRollup> BY_REVENUE =
            Comparator.comparingDouble(GroupRollup::revenue).reversed();

    private final FunnelLookup funnelLookup;
    private final SessionRepository sessionRepository;
    private final TimeBucketer bucketer;

    public AdPerformanceService(FunnelLookup funnelLookup, SessionRepository sessionRepository, TimeBucketer bucketer) {
        this.funnelLookup = funnelLookup;
        this.sessionRepository = sessionRepository;
        this.bucketer = bucketer;
    }

    /** Platforms and campaigns are ordered by revenue, highest first; ties keep count order. */
    public AdPerformanceResult adPerformance(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> converted = sessionRepository.findConvertedInWindow(funnelId, window);

        Map<String, List<FunnelSession>> byPlatform = new LinkedHashMap<>();
        for (FunnelSession session : converted) {
            byPlatform.computeIfAbsent(TrafficAnalyticsService.platform(session), k -> new ArrayList<>()).add(session);
        }

        RollupMetrics<FunnelSession> platformMetrics = RollupMetrics.<FunnelSession>of(
                        FunnelSession::conversionValueOrZero, null)
                .withSum("firstTouch", s -> hasClickId(s.firstTouch()) ? 1.0d : 0.0d)
                .withSum("lastTouch", s -> hasClickId(s.lastTouch()) ? 1.0d : 0.0d);
        List<GroupRollup> platformGroups = new ArrayList<>(
                RollupAggregator.rollup(converted, TrafficAnalyticsService::platform, platformMetrics));
        platformGroups.sort(BY_REVENUE);

        List<AdPerformanceResult.PlatformRow> platforms = new ArrayList<>(platformGroups.size());
        for (GroupRollup group : platformGroups) {
            platforms.add(new AdPerformanceResult.PlatformRow(
                    group.key(),
                    group.count(),
                    group.revenue(),
                    Math.round(group.sum("firstTouch")),
                    Math.round(group.sum("lastTouch")),
                    Percentages.average(group.revenue(), group.count()),
                    topCampaigns(byPlatform.get(group.key()))));
        }

        double totalRevenue = converted.stream()
                .mapToDouble(FunnelSession::conversionValueOrZero)
                .sum();
        log.debug("Ad performance funnel={} conversions={} platforms={}", funnelId, converted.size(), platforms.size());
        return new AdPerformanceResult(
                new AttributionResult.Summary(
                        converted.size(), totalRevenue, Percentages.average(totalRevenue, converted.size())),
                List.copyOf(platforms),
                timeline(converted));
    }

    private static List<AdPerformanceResult.CampaignRow> topCampaigns(List<FunnelSession> sessions) {
        List<GroupRollup> groups = new ArrayList<>(RollupAggregator.rollup(
                sessions,
                TrafficAnalyticsService::attributedCampaign,
                RollupMetrics.of(FunnelSession::conversionValueOrZero, null)));
        groups.sort(BY_REVENUE);
        List<AdPerformanceResult.CampaignRow> rows = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.limit(groups, TOP_CAMPAIGNS_PER_PLATFORM)) {
            rows.add(new AdPerformanceResult.CampaignRow(group.key(), group.count(), group.revenue()));
        }
        return List.copyOf(rows);
    }

    private List<AdPerformanceResult.TimelinePoint> timeline(List<FunnelSession> converted) {
        List<TimeBucket> days = bucketer.aggregateByDimension(
                converted, FunnelSession::startedAt, BucketGranularity.D1, TrafficAnalyticsService::platform);
        List<AdPerformanceResult.TimelinePoint> points = new ArrayList<>(days.size());
        for (TimeBucket day : days) {
            Map<String, Long> counts = new LinkedHashMap<>();
            long total = 0;
            for (Map.Entry<String, Double> entry : day.totals().entrySet()) {
                long count = Math.round(entry.getValue());
                counts.put(entry.getKey(), count);
                total += count;
            }
            points.add(new AdPerformanceResult.TimelinePoint(
                    day.start().atZone(bucketer.zone()).toLocalDate().toString(), total, counts));
        }
        return List.copyOf(points);
    }

    private static boolean hasClickId(TouchAttribution touch) {
        return present(touch.fbclid()) || present(touch.gclid()) || present(touch.ttclid());
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
