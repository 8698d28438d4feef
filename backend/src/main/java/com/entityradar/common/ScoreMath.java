package com.entityradar.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Single rounding and comparison helper for every score, ratio and monetary figure.
 * All rounding goes through {@link BigDecimal#valueOf(double)} so that a value printed as 0.8 is compared as 0.8
 * (0.8 - 0.7 is exactly 0.1 here, not 0.10000000000000009).
 */
public final class ScoreMath {

    /** Scores and confidence values. */
    public static final int SCORE_SCALE = 2;
    /** Ratios produced by feature extraction. */
    public static final int RATIO_SCALE = 3;
    /** ETH amounts. */
    public static final int MONEY_SCALE = 4;

    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private ScoreMath() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(scale, ROUNDING).doubleValue();
    }

    public static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** Clamp to [0,1] and round to 2 decimals. */
    public static double score(double value) {
        return round(clamp01(value), SCORE_SCALE);
    }

    public static double ratio(double value) {
        return round(value, RATIO_SCALE);
    }

    public static double money(double value) {
        return round(value, MONEY_SCALE);
    }

    /** Exact decimal difference {@code a - b}. */
    public static BigDecimal difference(double a, double b) {
        return BigDecimal.valueOf(a).subtract(BigDecimal.valueOf(b));
    }

    public static boolean atLeast(double value, double threshold) {
        return BigDecimal.valueOf(value).compareTo(BigDecimal.valueOf(threshold)) >= 0;
    }

    public static boolean atLeast(BigDecimal value, double threshold) {
        return value.compareTo(BigDecimal.valueOf(threshold)) >= 0;
    }

    public static boolean atMost(BigDecimal value, double threshold) {
        return value.compareTo(BigDecimal.valueOf(threshold)) <= 0;
    }
}
