/* (C)2026 */
package com.ammann.outlier.detection;

import java.util.Arrays;

/**
 * Descriptive statistics shared by the detection methods.
 *
 * <p>Standard deviation is the population form (divide by {@code n}). Percentiles use
 * linear interpolation between closest ranks on the sorted values, the default of the
 * common numeric libraries, so that quartiles and medians agree with other
 * implementations to the last bit. No method mutates its argument.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static double mean(double[] values) {
        requireNonEmpty(values);
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /** Population standard deviation. */
    public static double standardDeviation(double[] values) {
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / values.length);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /**
     * Linear-interpolation percentile.
     *
     * <p>The rank is {@code p / 100 * (n - 1)} on the ascending values; a fractional rank
     * interpolates between its two neighbours.
     *
     * @param values sample values, not modified
     * @param percentile percentile in {@code [0, 100]}
     * @return the interpolated percentile
     */
    public static double percentile(double[] values, double percentile) {
        requireNonEmpty(values);
        if (!(percentile >= 0.0 && percentile <= 100.0)) {
            throw new IllegalArgumentException("Percentile must be within [0, 100], got " + percentile);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }

    /** Median of the absolute deviations from the median. */
    public static double medianAbsoluteDeviation(double[] values) {
        return medianAbsoluteDeviation(values, median(values));
    }

    static double medianAbsoluteDeviation(double[] values, double median) {
        return median(absoluteDeviations(values, median));
    }

    /** {@code |x - center|} for every value, in input order. */
    public static double[] absoluteDeviations(double[] values, double center) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return deviations;
    }

    public static double min(double[] values) {
        requireNonEmpty(values);
        return Arrays.stream(values).min().getAsDouble();
    }

    public static double max(double[] values) {
        requireNonEmpty(values);
        return Arrays.stream(values).max().getAsDouble();
    }

    private static void requireNonEmpty(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Statistics require at least one value");
        }
    }
}
