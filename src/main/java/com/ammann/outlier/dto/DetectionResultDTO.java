/* (C)2026 */
package com.ammann.outlier.dto;

import com.ammann.outlier.detection.DetectionResult;
import com.ammann.outlier.detection.EnsembleResult;
import com.ammann.outlier.detection.MethodResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Data transfer object for the outcome of one detection strategy.
 *
 * <p>Single-method results fill {@code sampleScores}; ensemble results fill the voting
 * fields ({@code votes}, {@code methodsUsed}, {@code consensusThreshold},
 * {@code consensusVotesNeeded}, {@code individualResults}). Absent fields are omitted.
 */
@Schema(description = "Outlier detection result of a single method or of the ensemble")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionResultDTO(
        @Schema(description = "Detection method key", example = "ensemble")
        String method,

        @Schema(description = "COMPLETED, INSUFFICIENT_DATA or DEGENERATE_DISTRIBUTION")
        String status,

        @Schema(description = "Values flagged as outliers")
        List<Double> outlierValues,

        @Schema(description = "0-based positions of the flagged values in the analysed series")
        List<Integer> outlierIndices,

        @Schema(description = "Method-specific statistics (mean, std_dev, q1, q3, median, mad, ...)")
        Map<String, Double> diagnostics,

        @Schema(description = "Per-sample score used for the decision (z-score, modified z-score or deviation)")
        List<Double> sampleScores,

        @Schema(description = "Ensemble only: number of methods that flagged each sample")
        List<Integer> votes,

        @Schema(description = "Ensemble only: keys of the voting methods")
        List<String> methodsUsed,

        @Schema(description = "Ensemble only: fraction of methods that must agree")
        Double consensusThreshold,

        @Schema(description = "Ensemble only: votes required to flag a sample")
        Integer consensusVotesNeeded,

        @Schema(description = "Ensemble only: result of each voting method")
        Map<String, DetectionResultDTO> individualResults) {

    /**
     * Creates a DTO from an engine result.
     *
     * @param result single-method or ensemble result
     * @return a new {@code DetectionResultDTO}
     */
    public static DetectionResultDTO from(DetectionResult result) {
        if (result instanceof EnsembleResult ensemble) {
            Map<String, DetectionResultDTO> individual = new LinkedHashMap<>();
            ensemble.individualResults().forEach((key, value) -> individual.put(key, from(value)));
            return new DetectionResultDTO(
                    ensemble.methodName(),
                    ensemble.status().name(),
                    ensemble.outlierValues(),
                    ensemble.outlierIndices(),
                    ensemble.diagnostics(),
                    null,
                    ensemble.votes(),
                    ensemble.methodsUsed(),
                    ensemble.consensusThreshold(),
                    ensemble.consensusVotesNeeded(),
                    individual);
        }

        List<Double> sampleScores =
                result instanceof MethodResult single && !single.sampleScores().isEmpty()
                        ? single.sampleScores()
                        : null;
        return new DetectionResultDTO(
                result.methodName(),
                result.status().name(),
                result.outlierValues(),
                result.outlierIndices(),
                result.diagnostics(),
                sampleScores,
                null,
                null,
                null,
                null,
                null);
    }
}
