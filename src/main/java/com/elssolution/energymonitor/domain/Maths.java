package com.elssolution.energymonitor.domain;

import java.util.Arrays;

public final class Maths {
    private static final double EPS = 1e-9;

    private Maths() {}

    public static double safeDiv(double num, double den) {
        return Math.abs(den) < EPS ? 0.0 : num / den;
    }

    public static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    public static double mean(double[] v) {
        if (v.length == 0) return 0.0;
        double sum = 0.0;
        for (double x : v) sum += x;
        return sum / v.length;
    }

    /** Population standard deviation. */
    public static double stdev(double[] v) {
        if (v.length < 2) return 0.0;
        double m = mean(v);
        double acc = 0.0;
        for (double x : v) acc += (x - m) * (x - m);
        return Math.sqrt(acc / v.length);
    }

    public static double median(double[] v) {
        return percentile(v, 0.5);
    }

    /** Linear-interpolated percentile, q in [0,1]. Does not modify the input. */
    public static double percentile(double[] v, double q) {
        if (v.length == 0) return 0.0;
        double[] sorted = v.clone();
        Arrays.sort(sorted);
        double pos = clamp(q, 0.0, 1.0) * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        if (lo == hi) return sorted[lo];
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    public static double round(double v, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(v * scale) / scale;
    }
}
