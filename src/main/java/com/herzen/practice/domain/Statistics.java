package com.herzen.practice.domain;

import java.util.List;

public final class Statistics {

    private Statistics() {}

    public static double mean(List<? extends Number> values) {
        return values.stream().mapToDouble(Number::doubleValue).average().orElse(0.0);
    }

    /** Population variance. */
    public static double variance(List<? extends Number> values) {
        if (values.isEmpty()) return 0.0;
        double m = mean(values);
        return values.stream().mapToDouble(v -> Math.pow(v.doubleValue() - m, 2)).sum() / values.size();
    }

    /**
     * Ordinary least-squares slope of {@code ys} against their index. 0 for fewer than two points.
     */
    public static double slopeByIndex(List<? extends Number> ys) {
        int n = ys.size();
        if (n < 2) return 0.0;
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int x = 0; x < n; x++) {
            double y = ys.get(x).doubleValue();
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumXX += (double) x * x;
        }
        double denominator = n * sumXX - sumX * sumX;
        return denominator == 0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
    }
}
