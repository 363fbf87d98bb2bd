package com.aurea.service.core.query.session;

import java.util.List;

/** Averages are null when no session of the group measured the vital. */
public record PerformanceResult(Overall overall, List<DeviceRow> byDevice) {

    public record Overall(
            Double avgLcp,
            Double avgInp,
            Double avgCls,
            Double avgFcp,
            Double avgTtfb,
            Long avgExperienceScore,
            long totalSessions) {}

    /** {@code sessions} counts the device's sessions that carry an experience score. */
    public record DeviceRow(
            String device,
            Double avgLcp,
            Double avgInp,
            Double avgCls,
            Double avgFcp,
            Double avgTtfb,
            Long avgExperienceScore,
            long sessions) {}
}
