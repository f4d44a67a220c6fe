package com.outbreaksentinel.core.baseline;

/**
 * Population mean and standard deviation over a daily series.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
        // utility class — not instantiable
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double stdDev(double[] values, double mean) {
        if (values.length == 0) {
            return 0.0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }
}
