package com.aurea.service.core.query.event;

import java.util.List;

/** Seven days starting on Sunday ({@code dayIndex} 0), each with 24 hours. */
public record PurchaseHeatmapResult(
        List<Day> heatmapData, long totalPurchases, double totalRevenue, Peak peakTime, long maxPurchases) {

    public record Day(String day, int dayIndex, List<Hour> hours) {}

    public record Hour(int hour, long count, double revenue) {}

    public record Peak(String day, int dayIndex, int hour, long count, double revenue) {}
}
