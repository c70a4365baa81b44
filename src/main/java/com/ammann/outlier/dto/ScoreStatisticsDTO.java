/* (C)2026 */
package com.ammann.outlier.dto;

import com.ammann.outlier.detection.SeriesStatistics;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Descriptive statistics over a set of scores.
 *
 * <p>Quartile fields are only present in statistical summaries; outlier reports carry the
 * basic measures only.
 */
@Schema(description = "Descriptive statistics of a score population")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreStatisticsDTO(
        @Schema(description = "Population the statistics describe", example = "age_group_18-25")
        String scope,

        @Schema(description = "Number of scores")
        Long count,

        @Schema(description = "Arithmetic mean")
        Double mean,

        @Schema(description = "Median")
        Double median,

        @Schema(description = "Population standard deviation")
        Double standardDeviation,

        @Schema(description = "Smallest score")
        Double min,

        @Schema(description = "Largest score")
        Double max,

        @Schema(description = "25th percentile (linear interpolation)")
        Double q1,

        @Schema(description = "75th percentile (linear interpolation)")
        Double q3,

        @Schema(description = "Interquartile range q3 - q1")
        Double iqr) {

    /**
     * Computes the basic measures.
     *
     * @param scope population label, may be {@code null}
     * @param values score values, at least one
     */
    public static ScoreStatisticsDTO basic(String scope, double[] values) {
        return new ScoreStatisticsDTO(
                scope,
                (long) values.length,
                SeriesStatistics.mean(values),
                SeriesStatistics.median(values),
                SeriesStatistics.standardDeviation(values),
                SeriesStatistics.min(values),
                SeriesStatistics.max(values),
                null,
                null,
                null);
    }

    /**
     * Computes the basic measures plus quartiles and IQR.
     */
    public static ScoreStatisticsDTO withQuartiles(String scope, double[] values) {
        double q1 = SeriesStatistics.percentile(values, 25.0);
        double q3 = SeriesStatistics.percentile(values, 75.0);
        return new ScoreStatisticsDTO(
                scope,
                (long) values.length,
                SeriesStatistics.mean(values),
                SeriesStatistics.median(values),
                SeriesStatistics.standardDeviation(values),
                SeriesStatistics.min(values),
                SeriesStatistics.max(values),
                q1,
                q3,
                q3 - q1);
    }
}
