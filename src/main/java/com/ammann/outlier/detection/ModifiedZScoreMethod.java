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
 * Robust z-score after Iglewicz and Hoaglin.
 *
 * <p>Computes {@code M = 0.6745 * |x - median| / MAD} and flags {@code M > threshold}.
 * The constant 0.6745 is the 0.75 quantile of the standard normal distribution, which
 * makes the MAD a consistent estimator of the standard deviation under normality.
 *
 * <p>Kept separate from {@link MadMethod}: both vote in the ensemble and each has its own
 * threshold.
 */
public final class ModifiedZScoreMethod implements OutlierMethod {

    private static final Logger LOG = Logger.getLogger(ModifiedZScoreMethod.class);

    static final int MIN_SAMPLES = 2;

    /** Normal-consistency constant, must stay exactly 0.6745. */
    public static final double CONSISTENCY_CONSTANT = 0.6745;

    private final double threshold;

    public ModifiedZScoreMethod() {
        this(DetectionConfig.DEFAULT_MODIFIED_ZSCORE_THRESHOLD);
    }

    public ModifiedZScoreMethod(double threshold) {
        this.threshold = Parameters.requirePositive("threshold", threshold);
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.MODIFIED_ZSCORE;
    }

    @Override
    public int minimumSamples() {
        return MIN_SAMPLES;
    }

    @Override
    public MethodResult detect(SampleSeries series) {
        if (series.size() < minimumSamples()) {
            LOG.debugf(
                    "Modified z-score skipped: %d samples, %d required", series.size(), MIN_SAMPLES);
            return MethodResult.empty(method(), ResultStatus.INSUFFICIENT_DATA);
        }

        double[] values = series.values();
        double median = SeriesStatistics.median(values);
        double mad = SeriesStatistics.medianAbsoluteDeviation(values, median);

        if (mad == 0.0) {
            LOG.debug("Modified z-score skipped: zero MAD");
            return MethodResult.empty(method(), ResultStatus.DEGENERATE_DISTRIBUTION);
        }

        List<Double> modifiedZScores = new ArrayList<>(values.length);
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double score = CONSISTENCY_CONSTANT * Math.abs((values[i] - median) / mad);
            modifiedZScores.add(score);
            if (score > threshold) {
                indices.add(i);
            }
        }

        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("median", median);
        diagnostics.put("mad", mad);
        diagnostics.put("threshold", threshold);

        LOG.debugf(
                "Modified z-score flagged %d of %d samples (median=%.4f, mad=%.4f)",
                indices.size(), values.length, median, mad);

        return new MethodResult(
                method(),
                series.valuesAt(indices),
                indices,
                diagnostics,
                modifiedZScores,
                ResultStatus.COMPLETED);
    }
}
