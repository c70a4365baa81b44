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
 * Flags samples whose absolute deviation from the median exceeds {@code threshold * MAD}.
 *
 * <p>Unlike {@link ModifiedZScoreMethod} the deviation is not normalized, so the threshold
 * is expressed directly in MAD units.
 */
public final class MadMethod implements OutlierMethod {

    private static final Logger LOG = Logger.getLogger(MadMethod.class);

    static final int MIN_SAMPLES = 2;

    private final double threshold;

    public MadMethod() {
        this(DetectionConfig.DEFAULT_MAD_THRESHOLD);
    }

    public MadMethod(double threshold) {
        this.threshold = Parameters.requirePositive("threshold", threshold);
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.MAD;
    }

    @Override
    public int minimumSamples() {
        return MIN_SAMPLES;
    }

    @Override
    public MethodResult detect(SampleSeries series) {
        if (series.size() < minimumSamples()) {
            LOG.debugf("MAD skipped: %d samples, %d required", series.size(), MIN_SAMPLES);
            return MethodResult.empty(method(), ResultStatus.INSUFFICIENT_DATA);
        }

        double[] values = series.values();
        double median = SeriesStatistics.median(values);
        double[] deviations = SeriesStatistics.absoluteDeviations(values, median);
        double mad = SeriesStatistics.median(deviations);

        if (mad == 0.0) {
            LOG.debug("MAD skipped: zero MAD");
            return MethodResult.empty(method(), ResultStatus.DEGENERATE_DISTRIBUTION);
        }

        double cutoff = threshold * mad;
        List<Double> deviationScores = new ArrayList<>(deviations.length);
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < deviations.length; i++) {
            deviationScores.add(deviations[i]);
            if (deviations[i] > cutoff) {
                indices.add(i);
            }
        }

        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("median", median);
        diagnostics.put("mad", mad);
        diagnostics.put("threshold", threshold);

        LOG.debugf(
                "MAD flagged %d of %d samples (median=%.4f, cutoff=%.4f)",
                indices.size(), values.length, median, cutoff);

        return new MethodResult(
                method(),
                series.valuesAt(indices),
                indices,
                diagnostics,
                deviationScores,
                ResultStatus.COMPLETED);
    }
}
