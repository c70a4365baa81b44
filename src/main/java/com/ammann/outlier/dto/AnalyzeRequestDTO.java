/* (C)2026 */
package com.ammann.outlier.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Ad-hoc analysis request over a caller-supplied series.
 *
 * @param values scores in analysis order
 * @param method detection method key, defaults to {@code ensemble}
 * @param threshold override for the z-score, modified z-score and MAD thresholds or the IQR
 *     fence multiplier
 * @param consensusThreshold override for the ensemble consensus fraction
 */
@Schema(description = "Series to analyse without touching stored scores")
public record AnalyzeRequestDTO(
        @Schema(description = "Scores in analysis order", required = true) List<Double> values,
        @Schema(description = "Detection method key", example = "ensemble") String method,
        @Schema(description = "Threshold or IQR multiplier override") Double threshold,
        @Schema(description = "Ensemble consensus fraction override", example = "0.5")
                Double consensusThreshold) {}
