/* (C)2026 */
package com.ammann.outlier.detection;

import java.time.Instant;
import java.util.List;

/**
 * Temporal stability of a score history.
 *
 * @param totalSamplesInWindow number of samples analysed
 * @param inconsistentTransitionCount number of entries in {@code transitions}
 * @param meanAbsChange mean of the absolute consecutive differences
 * @param stdAbsChange population standard deviation of the absolute consecutive differences
 * @param coefficientOfVariation {@code std / mean * 100} over the raw values, 0 when the
 *     mean is 0
 * @param highlyInconsistent whether the coefficient of variation exceeds the configured limit
 * @param transitions abnormally large jumps, in series order
 * @param insufficientData {@code true} when fewer than two samples were supplied
 */
public record InconsistencyReport(
        int totalSamplesInWindow,
        int inconsistentTransitionCount,
        double meanAbsChange,
        double stdAbsChange,
        double coefficientOfVariation,
        boolean highlyInconsistent,
        List<Transition> transitions,
        boolean insufficientData) {

    public InconsistencyReport {
        transitions = List.copyOf(transitions);
    }

    static InconsistencyReport insufficientData(int sampleCount) {
        return new InconsistencyReport(sampleCount, 0, 0.0, 0.0, 0.0, false, List.of(), true);
    }

    /**
     * A jump between the samples at {@code index} and {@code index + 1}.
     *
     * @param index position of the earlier sample
     * @param fromValue value before the jump
     * @param toValue value after the jump
     * @param change signed difference {@code toValue - fromValue}
     * @param fromTimestamp timestamp of the earlier sample, may be {@code null}
     * @param toTimestamp timestamp of the later sample, may be {@code null}
     */
    public record Transition(
            int index,
            double fromValue,
            double toValue,
            double change,
            Instant fromTimestamp,
            Instant toTimestamp) {}
}
