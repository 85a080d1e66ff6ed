package com.rymharvest.aggregation;

import java.util.function.DoubleUnaryOperator;

/**
 * Scaling rules that map raw magnitudes onto [0, 1]. All rules are pure and clamp their output.
 */
public final class Normalizers {
    private Normalizers() {}

    /**
     * Values already in [0, 1]; out-of-range input is clamped.
     */
    public static DoubleUnaryOperator unit() {
        return Normalizers::clamp;
    }

    /**
     * Linear scaling of [min, max] onto [0, 1].
     */
    public static DoubleUnaryOperator range(double min, double max) {
        if (max <= min) throw new IllegalArgumentException("max must be greater than min");
        return v -> clamp((v - min) / (max - min));
    }

    /**
     * Logarithmic scaling of counts: 0 maps to 0, {@code max} and above map to 1.
     */
    public static DoubleUnaryOperator logScale(double max) {
        if (max <= 0) throw new IllegalArgumentException("max must be positive");
        double denominator = Math.log1p(max);
        return v -> clamp(Math.log1p(Math.max(0, v)) / denominator);
    }

    /**
     * Rank scaling: rank 1 maps to 1, rank {@code maxRank} and worse map to 0, 0 (unranked) maps to 0.
     */
    public static DoubleUnaryOperator inverseRank(double maxRank) {
        if (maxRank <= 1) throw new IllegalArgumentException("maxRank must be greater than 1");
        return v -> v < 1 ? 0 : clamp((maxRank - Math.min(v, maxRank)) / (maxRank - 1));
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(1, v));
    }
}
