/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.enumeration.DetectionMethod;
import com.ammann.outlier.enumeration.ResultStatus;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one univariate detection method.
 *
 * @param method the method that produced this result
 * @param outlierValues flagged sample values
 * @param outlierIndices positions of the flagged samples in the input series
 * @param diagnostics method statistics, insertion ordered; empty unless {@code COMPLETED}
 * @param sampleScores per-sample score the flag decision was based on (absolute z-score,
 *     modified z-score or absolute deviation), one per input sample; empty when the method
 *     does not score samples individually or did not run
 * @param status whether the method ran or fell back to a neutral result
 */
public record MethodResult(
        DetectionMethod method,
        List<Double> outlierValues,
        List<Integer> outlierIndices,
        Map<String, Double> diagnostics,
        List<Double> sampleScores,
        ResultStatus status)
        implements DetectionResult {

    public MethodResult {
        outlierValues = List.copyOf(outlierValues);
        outlierIndices = List.copyOf(outlierIndices);
        diagnostics = Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
        sampleScores = List.copyOf(sampleScores);
    }

    /**
     * Neutral result for input the method cannot score.
     */
    public static MethodResult empty(DetectionMethod method, ResultStatus status) {
        return new MethodResult(method, List.of(), List.of(), Map.of(), List.of(), status);
    }
}
