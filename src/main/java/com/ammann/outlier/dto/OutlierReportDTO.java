/* (C)2026 */
package com.ammann.outlier.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outlier analysis of stored scores for a user, an age group or the whole population.
 */
@Schema(description = "Outlier detection report over stored scores")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutlierReportDTO(
        @Schema(description = "user, age_group or global")
        String scope,

        @Schema(description = "Username or age group analysed; absent for global reports")
        String subject,

        @Schema(description = "Number of scores analysed")
        Integer totalScores,

        @Schema(description = "Number of scores flagged")
        Integer outlierCount,

        @Schema(description = "Detection method key", example = "ensemble")
        String detectionMethod,

        @Schema(description = "Flagged scores with their stored metadata")
        List<OutlierDetailDTO> outlierDetails,

        @Schema(description = "Population statistics (age group and global reports)")
        ScoreStatisticsDTO statistics,

        @Schema(description = "Raw engine result")
        DetectionResultDTO result,

        @Schema(description = "Time the analysis ran")
        Instant analyzedAt) {}
