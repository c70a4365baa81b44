/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.enumeration.DetectionMethod;
import com.ammann.outlier.enumeration.ResultStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Flags samples whose standardized distance from the mean exceeds a threshold.
 *
 * <p>Computes {@code z = |x - mean| / std} with the population standard deviation and
 * flags {@code z > threshold}. Sensitive to the very outliers it looks for, since they
 * inflate the standard deviation.
 */
public final class ZScoreMethod implements OutlierMethod {

    private static final Logger LOG = Logger.getLogger(ZScoreMethod.class);

    static final int MIN_SAMPLES = 2;

    private final double threshold;

    public ZScoreMethod() {
        this(DetectionConfig.DEFAULT_ZSCORE_THRESHOLD);
    }

    public ZScoreMethod(double threshold) {
        this.threshold = Parameters.requirePositive("threshold", threshold);
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public int minimumSamples() {
        return MIN_SAMPLES;
    }

    @Override
    public MethodResult detect(SampleSeries series) {
        if (series.size() < minimumSamples()) {
            LOG.debugf("Z-score skipped: %d samples, %d required", series.size(), MIN_SAMPLES);
            return MethodResult.empty(method(), ResultStatus.INSUFFICIENT_DATA);
        }

        double[] values = series.values();
        double mean = SeriesStatistics.mean(values);
        double stdDev = SeriesStatistics.standardDeviation(values);

        if (stdDev == 0.0) {
            LOG.debug("Z-score skipped: zero standard deviation");
            return MethodResult.empty(method(), ResultStatus.DEGENERATE_DISTRIBUTION);
        }

        List<Double> zScores = new ArrayList<>(values.length);
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double z = Math.abs((values[i] - mean) / stdDev);
            zScores.add(z);
            if (z > threshold) {
                indices.add(i);
            }
        }

        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("mean", mean);
        diagnostics.put("std_dev", stdDev);
        diagnostics.put("threshold", threshold);

        LOG.debugf(
                "Z-score flagged %d of %d samples (mean=%.4f, std=%.4f, threshold=%.2f)",
                indices.size(), values.length, mean, stdDev, threshold);

        return new MethodResult(
                method(),
                series.valuesAt(indices),
                indices,
                diagnostics,
                zScores,
                ResultStatus.COMPLETED);
    }
}
