package com.aurea.service.core.query.vitals;

import java.util.List;

/**
 * @param passingRate share of all measurements rated good, 0-100
 * @param totalVitals measurements in the window across every metric
 */
public record WebVitalsStatsResult(List<MetricStats> stats, double passingRate, long totalVitals) {

    /**
     * Percentiles use the nearest-rank element {@code sorted[floor(total * p)]}. Rating shares are 0-100 and do not
     * need to add up to 100 when some measurements carry no rating.
     */
    public record MetricStats(
            String metric,
            long total,
            double avg,
            double p50,
            double p75,
            double p90,
            double p95,
            double min,
            double max,
            long goodCount,
            long needsImprovementCount,
            long poorCount,
            double goodPercent,
            double needsImprovementPercent,
            double poorPercent) {}
}
