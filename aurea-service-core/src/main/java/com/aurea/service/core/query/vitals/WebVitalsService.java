package com.aurea.service.core.query.vitals;

import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.model.VitalRating;
import com.aurea.service.core.model.WebVitalSample;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.WebVitalRepository;
import com.aurea.service.core.rollup.GroupRollup;
import com.aurea.service.core.rollup.RollupAggregator;
import com.aurea.service.core.rollup.RollupMetrics;
import com.aurea.service.core.support.Percentages;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Distribution statistics over individual web-vital measurements, one row per metric. */
@Service
public class WebVitalsService {
    // Good ratings are tallied as the rollup's conversions.
    private static final RollupMetrics<WebVitalSample> METRICS = RollupMetrics.<WebVitalSample>of(
                    null, sample -> sample.rating() == VitalRating.GOOD)
            .withSum("value", WebVitalSample::value)
            .withSum("needsImprovement", sample -> rated(sample, VitalRating.NEEDS_IMPROVEMENT))
            .withSum("poor", sample -> rated(sample, VitalRating.POOR));

    private final FunnelLookup funnelLookup;
    private final WebVitalRepository webVitalRepository;

    public WebVitalsService(FunnelLookup funnelLookup, WebVitalRepository webVitalRepository) {
        this.funnelLookup = funnelLookup;
        this.webVitalRepository = webVitalRepository;
    }

    /** Metrics are ordered by measurement count, most measured first. */
    public WebVitalsStatsResult stats(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<WebVitalSample> samples = webVitalRepository.findInWindow(funnelId, window);

        Map<String, List<Double>> valuesByMetric = new HashMap<>();
        for (WebVitalSample sample : samples) {
            valuesByMetric.computeIfAbsent(metricKey(sample), k -> new ArrayList<>()).add(sample.value());
        }

        long passing = 0;
        List<WebVitalsStatsResult.MetricStats> stats = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.rollup(samples, WebVitalsService::metricKey, METRICS)) {
            List<Double> values = valuesByMetric.get(group.key());
            values.sort(null);
            long needsImprovement = Math.round(group.sum("needsImprovement"));
            long poor = Math.round(group.sum("poor"));
            passing += group.conversions();
            stats.add(new WebVitalsStatsResult.MetricStats(
                    group.key(),
                    group.count(),
                    group.average("value"),
                    percentile(values, 0.5d),
                    percentile(values, 0.75d),
                    percentile(values, 0.9d),
                    percentile(values, 0.95d),
                    values.get(0),
                    values.get(values.size() - 1),
                    group.conversions(),
                    needsImprovement,
                    poor,
                    Percentages.round(group.conversionRate(), 2),
                    Percentages.round(Percentages.percent(needsImprovement, group.count()), 2),
                    Percentages.round(Percentages.percent(poor, group.count()), 2)));
        }
        return new WebVitalsStatsResult(
                List.copyOf(stats), Percentages.round(Percentages.percent(passing, samples.size()), 2), samples.size());
    }

    /** Nearest-rank element at {@code floor(n * p)} of an ascending list; 0 for an empty list. */
    static double percentile(List<Double> sorted, double p) {
        if (sorted.isEmpty()) {
            return 0.0d;
        }
        int index = (int) Math.floor(sorted.size() * p);
        return sorted.get(Math.min(index, sorted.size() - 1));
    }

    private static String metricKey(WebVitalSample sample) {
        return sample.metric() == null ? RollupAggregator.UNKNOWN_KEY : sample.metric();
    }

    private static double rated(WebVitalSample sample, VitalRating rating) {
        return sample.rating() == rating ? 1.0d : 0.0d;
    }
}
