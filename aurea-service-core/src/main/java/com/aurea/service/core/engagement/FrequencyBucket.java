package com.aurea.service.core.engagement;

/** Per-visitor occurrence ranges, in display order. */
public enum FrequencyBucket {
    ONE("1", 1, 1),
    TWO("2", 2, 2),
    THREE("3", 3, 3),
    FOUR("4", 4, 4),
    FIVE("5", 5, 5),
    SIX_TO_TEN("6-10", 6, 10),
    ELEVEN_TO_TWENTY("11-20", 11, 20),
    TWENTY_ONE_PLUS("21+", 21, Long.MAX_VALUE);

    private final String wireValue;
    private final long min;
    private final long max;

    FrequencyBucket(String wireValue, long min, long max) {
        this.wireValue = wireValue;
        this.min = min;
        this.max = max;
    }

    public String wireValue() {
        return wireValue;
    }

    public String label() {
        return wireValue + "x";
    }

    public static FrequencyBucket of(long occurrences) {
        for (FrequencyBucket bucket : values()) {
            if (occurrences >= bucket.min && occurrences <= bucket.max) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("Occurrences must be positive: " + occurrences);
    }
}
