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
 * Tukey fences: flags samples strictly outside {@code [Q1 - m*IQR, Q3 + m*IQR]}.
 *
 * <p>Quartiles use linear-interpolation percentiles. Needs at least four samples for the
 * quartiles to mean anything. A zero IQR is not treated as degenerate: the fences collapse
 * onto the quartiles and any value outside them is flagged, while a constant series still
 * flags nothing.
 */
public final class IqrMethod implements OutlierMethod {

    private static final Logger LOG = Logger.getLogger(IqrMethod.class);

    static final int MIN_SAMPLES = 4;

    private final double multiplier;

    public IqrMethod() {
        this(DetectionConfig.DEFAULT_IQR_MULTIPLIER);
    }

    public IqrMethod(double multiplier) {
        this.multiplier = Parameters.requirePositive("iqrMultiplier", multiplier);
    }

    public double multiplier() {
        return multiplier;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.IQR;
    }

    @Override
    public int minimumSamples() {
        return MIN_SAMPLES;
    }

    @Override
    public MethodResult detect(SampleSeries series) {
        if (series.size() < minimumSamples()) {
            LOG.debugf("IQR skipped: %d samples, %d required", series.size(), MIN_SAMPLES);
            return MethodResult.empty(method(), ResultStatus.INSUFFICIENT_DATA);
        }

        double[] values = series.values();
        double q1 = SeriesStatistics.percentile(values, 25.0);
        double q3 = SeriesStatistics.percentile(values, 75.0);
        double iqr = q3 - q1;
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;

        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] < lowerBound || values[i] > upperBound) {
                indices.add(i);
            }
        }

        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("q1", q1);
        diagnostics.put("q3", q3);
        diagnostics.put("iqr", iqr);
        diagnostics.put("lower_bound", lowerBound);
        diagnostics.put("upper_bound", upperBound);
        diagnostics.put("iqr_multiplier", multiplier);

        LOG.debugf(
                "IQR flagged %d of %d samples (bounds=[%.4f, %.4f])",
                indices.size(), values.length, lowerBound, upperBound);

        return new MethodResult(
                method(),
                series.valuesAt(indices),
                indices,
                diagnostics,
                List.of(),
                ResultStatus.COMPLETED);
    }
}
