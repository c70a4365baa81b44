/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.enumeration.DetectionMethod;
import com.ammann.outlier.enumeration.ResultStatus;
import java.util.List;
import java.util.Map;

/**
 * Uniform view over the outcome of any detection strategy, single method or ensemble.
 *
 * <p>{@link #outlierIndices()} are 0-based positions into the analysed
 * {@link SampleSeries}, ascending; {@link #outlierValues()} lists the flagged values in the
 * same order.
 */
public interface DetectionResult {

    DetectionMethod method();

    List<Double> outlierValues();

    List<Integer> outlierIndices();

    /** Method-specific statistics such as {@code mean}, {@code q1} or {@code mad}. */
    Map<String, Double> diagnostics();

    ResultStatus status();

    default String methodName() {
        return method().key();
    }

    default int outlierCount() {
        return outlierIndices().size();
    }

    default boolean hasOutliers() {
        return !outlierIndices().isEmpty();
    }
}
