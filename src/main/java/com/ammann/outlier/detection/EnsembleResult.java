/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.enumeration.DetectionMethod;
import com.ammann.outlier.enumeration.ResultStatus;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of consensus voting across the univariate methods.
 *
 * @param outlierValues values of samples that reached the vote quorum
 * @param outlierIndices positions of those samples in the input series
 * @param votes per-sample count of methods that flagged it, one entry per input sample
 * @param methodsUsed keys of the voting methods, in the order they were run
 * @param consensusThreshold required fraction of agreeing methods, in {@code (0, 1]}
 * @param consensusVotesNeeded {@code ceil(methodsUsed.size() * consensusThreshold)}
 * @param individualResults each voter's own result, keyed by method key
 * @param status {@code INSUFFICIENT_DATA} when the series was too short to vote on
 */
public record EnsembleResult(
        List<Double> outlierValues,
        List<Integer> outlierIndices,
        List<Integer> votes,
        List<String> methodsUsed,
        double consensusThreshold,
        int consensusVotesNeeded,
        Map<String, MethodResult> individualResults,
        ResultStatus status)
        implements DetectionResult {

    public EnsembleResult {
        outlierValues = List.copyOf(outlierValues);
        outlierIndices = List.copyOf(outlierIndices);
        votes = List.copyOf(votes);
        methodsUsed = List.copyOf(methodsUsed);
        individualResults = Collections.unmodifiableMap(new LinkedHashMap<>(individualResults));
    }

    static EnsembleResult insufficientData(double consensusThreshold) {
        return new EnsembleResult(
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                consensusThreshold,
                0,
                Map.of(),
                ResultStatus.INSUFFICIENT_DATA);
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ENSEMBLE;
    }

    @Override
    public Map<String, Double> diagnostics() {
        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("consensus_threshold", consensusThreshold);
        diagnostics.put("consensus_votes_needed", (double) consensusVotesNeeded);
        return Collections.unmodifiableMap(diagnostics);
    }

    /** Votes received by the sample at {@code index}; 0 when no vote was taken. */
    public int votesFor(int index) {
        return votes.isEmpty() ? 0 : votes.get(index);
    }
}
