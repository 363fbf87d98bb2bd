package com.aurea.service.core.rollup;

import com.aurea.service.core.support.Percentages;
import java.util.List;
import java.util.Map;

/**
 * One group of a rollup. Values are exact; callers round when they build response records.
 *
 * @param dimensions key parts, one per key extractor
 * @param percentage share of all input rows, 0-100
 * @param conversionRate converted rows over rows in this group, 0-100
 */
public record GroupRollup(
        List<String> dimensions,
        long count,
        long conversions,
        double revenue,
        double percentage,
        double conversionRate,
        Map<String, Double> sums) {

    public String key() {
        return dimensions.get(0);
    }

    public String dimension(int index) {
        return dimensions.get(index);
    }

    public double sum(String name) {
        Double value = sums.get(name);
        return value == null ? 0.0d : value;
    }

    public double average(String name) {
        return Percentages.average(sum(name), count);
    }
}
