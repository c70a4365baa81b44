/* (C)2026 */
package com.ammann.outlier.detection;

import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Detects unstable score trajectories in a single time-ordered history.
 *
 * <p>Two independent signals are reported:
 * <ul>
 *   <li>inconsistent transitions: consecutive absolute differences
 *       {@code d[i] = |x[i+1] - x[i]|} with {@code d[i] > mean(d) + k * std(d)}</li>
 *   <li>overall instability: the coefficient of variation {@code std(x) / mean(x) * 100}
 *       of the raw values compared against a percentage limit</li>
 * </ul>
 *
 * <p>Windowing is the caller's job; the analyzer looks at the whole series it is given.
 * With population statistics no difference can lie more than {@code sqrt(n - 1)} standard
 * deviations above the mean of {@code n} differences, so at {@code k = 2} a transition can
 * only be flagged once a history has more than five of them.
 */
public final class InconsistencyAnalyzer {

    private static final Logger LOG = Logger.getLogger(InconsistencyAnalyzer.class);

    static final int MIN_SAMPLES = 2;

    private final double sigmaMultiplier;
    private final double highCvPercent;

    public InconsistencyAnalyzer() {
        this(
                DetectionConfig.DEFAULT_INCONSISTENCY_SIGMA_MULTIPLIER,
                DetectionConfig.DEFAULT_HIGH_INCONSISTENCY_CV_PERCENT);
    }

    public InconsistencyAnalyzer(double sigmaMultiplier, double highCvPercent) {
        this.sigmaMultiplier = Parameters.requirePositive("sigmaMultiplier", sigmaMultiplier);
        this.highCvPercent = Parameters.requirePositive("highCvPercent", highCvPercent);
    }

    public InconsistencyReport analyze(SampleSeries series) {
        if (series.size() < MIN_SAMPLES) {
            LOG.debugf("Inconsistency analysis skipped: %d samples", series.size());
            return InconsistencyReport.insufficientData(series.size());
        }

        double[] values = series.values();
        double[] absChanges = new double[values.length - 1];
        for (int i = 0; i < absChanges.length; i++) {
            absChanges[i] = Math.abs(values[i + 1] - values[i]);
        }

        double meanAbsChange = SeriesStatistics.mean(absChanges);
        double stdAbsChange = SeriesStatistics.standardDeviation(absChanges);
        double limit = meanAbsChange + sigmaMultiplier * stdAbsChange;

        List<InconsistencyReport.Transition> transitions = new ArrayList<>();
        for (int i = 0; i < absChanges.length; i++) {
            if (absChanges[i] > limit) {
                Sample from = series.get(i);
                Sample to = series.get(i + 1);
                transitions.add(
                        new InconsistencyReport.Transition(
                                i,
                                from.value(),
                                to.value(),
                                to.value() - from.value(),
                                from.timestamp(),
                                to.timestamp()));
            }
        }

        double mean = SeriesStatistics.mean(values);
        double cv = mean != 0.0 ? SeriesStatistics.standardDeviation(values) / mean * 100.0 : 0.0;
        boolean highlyInconsistent = cv > highCvPercent;

        LOG.debugf(
                "Inconsistency analysis: %d samples, %d inconsistent transitions, cv=%.2f%% (limit %.1f%%)",
                values.length, transitions.size(), cv, highCvPercent);

        return new InconsistencyReport(
                values.length,
                transitions.size(),
                meanAbsChange,
                stdAbsChange,
                cv,
                highlyInconsistent,
                transitions,
                false);
    }
}
