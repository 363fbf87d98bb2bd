package com.aurea.service.core.query.session;

/** Session length bands, lower bound inclusive, upper bound exclusive. */
public enum DurationBand {
    UP_TO_30S("0-30s", 0, 30),
    UP_TO_1M("30s-1m", 30, 60),
    UP_TO_2M("1-2m", 60, 120),
    UP_TO_5M("2-5m", 120, 300),
    UP_TO_10M("5-10m", 300, 600),
    OVER_10M("10m+", 600, Integer.MAX_VALUE);

    private final String range;
    private final int minSeconds;
    private final int maxSeconds;

    DurationBand(String range, int minSeconds, int maxSeconds) {
        this.range = range;
        this.minSeconds = minSeconds;
        this.maxSeconds = maxSeconds;
    }

    public String range() {
        return range;
    }

    public int minSeconds() {
        return minSeconds;
    }

    public int maxSeconds() {
        return maxSeconds;
    }

    /** Null for negative durations. */
    public static DurationBand of(int seconds) {
        for (DurationBand band : values()) {
            if (seconds >= band.minSeconds && seconds < band.maxSeconds) {
                return band;
            }
        }
        return seconds >= OVER_10M.minSeconds ? OVER_10M : null;
    }
}
