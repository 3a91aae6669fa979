package com.testinsight.analyzer;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding {

    private static final double MICROS = 1_000_000d;

    private Rounding() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /** Percentage of {@code part} in {@code total}, one decimal, 0 when total is 0. */
    public static double percentage(long part, long total) {
        if (total <= 0) return 0.0;
        return round(part * 100.0 / total, 1);
    }

    // Durations are summed as integral microseconds so totals do not depend on fold order.
    public static long toMicros(double seconds) {
        return Math.round(seconds * MICROS);
    }

    public static double toSeconds(long micros) {
        return micros / MICROS;
    }
}
