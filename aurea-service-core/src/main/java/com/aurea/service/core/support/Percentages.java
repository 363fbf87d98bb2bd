package com.aurea.service.core.support;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Division-guarded rate math. Zero denominators always produce zero. */
public final class Percentages {

    private Percentages() {}

    public static double percent(double part, double whole) {
        return whole == 0.0d ? 0.0d : part / whole * 100.0d;
    }

    public static double ratio(double part, double whole) {
        return whole == 0.0d ? 0.0d : part / whole;
    }

    public static double average(double total, long count) {
        return count == 0L ? 0.0d : total / count;
    }

    public static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0d;
        }
        return BigDecimal.valueOf(value)
                .setScale(Math.max(0, decimals), RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static Double roundOrNull(Double value, int decimals) {
        return value == null ? null : round(value, decimals);
    }

    /** Fixed two-decimal rendering, e.g. {@code "20.00"}. */
    public static String format2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0.00";
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
