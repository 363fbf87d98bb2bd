package com.aurea.service.core.bucket;

import com.aurea.service.core.model.TimeWindow;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Granularities supported for time-series analytics.
 */
public enum BucketGranularity {
    M15("15min", Duration.ofMinutes(15)),
    M30("30min", Duration.ofMinutes(30)),
    H1("hour", Duration.ofHours(1)),
    H4("4hour", Duration.ofHours(4)),
    D1("day", Duration.ofDays(1));

    private final String wireValue;
    private final Duration duration;

    BucketGranularity(String wireValue, Duration duration) {
        this.wireValue = wireValue;
        this.duration = duration;
    }

    public String wireValue() {
        return wireValue;
    }

    public Duration duration() {
        return duration;
    }

    /** Floors the zoned time to the start of its bucket. */
    public ZonedDateTime align(ZonedDateTime zdt) {
        return switch (this) {
            case M15 -> zdt.withMinute((zdt.getMinute() / 15) * 15).withSecond(0).withNano(0);
            case M30 -> zdt.withMinute((zdt.getMinute() / 30) * 30).withSecond(0).withNano(0);
            case H1 -> zdt.withMinute(0).withSecond(0).withNano(0);
            case H4 -> zdt.withHour((zdt.getHour() / 4) * 4)
                    .withMinute(0)
                    .withSecond(0)
                    .withNano(0);
            case D1 -> zdt.toLocalDate().atStartOfDay(zdt.getZone());
        };
    }

    /** Start of the bucket following the aligned {@code start}. */
    public ZonedDateTime next(ZonedDateTime start) {
        return this == D1 ? start.plusDays(1) : start.plus(duration);
    }

    /** Hourly buckets for windows up to a day, daily beyond. */
    public static BucketGranularity trendDefault(TimeWindow window) {
        return window.length().compareTo(Duration.ofHours(24)) <= 0 ? H1 : D1;
    }

    public static BucketGranularity fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return H4;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "15min", "15m", "m15" -> M15;
            case "30min", "30m", "m30" -> M30;
            case "hour", "1h", "h1" -> H1;
            case "4hour", "4h", "h4" -> H4;
            case "day", "1d", "d1" -> D1;
            default -> throw new IllegalArgumentException("Unsupported bucket granularity: " + value);
        };
    }
}
