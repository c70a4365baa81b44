/* (C)2026 */
package com.ammann.outlier.dto;

import com.ammann.outlier.detection.InconsistencyReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Temporal inconsistency of a user's recent score history.
 *
 * <p>When fewer than two scores fall inside the window the report carries
 * {@code insufficientData = true} and an explanatory message instead of statistics.
 */
@Schema(description = "Score trajectory inconsistency report")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InconsistencyReportDTO(
        @Schema(description = "Analysed user")
        String username,

        @Schema(description = "Look-back window in days")
        Integer timeWindowDays,

        @Schema(description = "Scores inside the window")
        Integer totalScoresInWindow,

        @Schema(description = "Number of abnormally large jumps")
        Integer inconsistentTransitions,

        @Schema(description = "Mean absolute change between consecutive scores")
        Double meanChange,

        @Schema(description = "Standard deviation of the absolute changes")
        Double stdChange,

        @Schema(description = "Coefficient of variation of the scores, in percent")
        Double coefficientOfVariation,

        @Schema(description = "True when the coefficient of variation exceeds the configured limit")
        Boolean highlyInconsistent,

        @Schema(description = "True when the window holds fewer than two scores")
        Boolean insufficientData,

        @Schema(description = "Explanation for insufficient data")
        String message,

        @Schema(description = "The abnormally large jumps")
        List<TransitionDTO> inconsistencyDetails) {

    /**
     * Creates a DTO from an engine report.
     *
     * @param username analysed user
     * @param windowDays look-back window
     * @param report engine report
     * @param scoreIds stored ids of the analysed scores, in series order
     */
    public static InconsistencyReportDTO from(
            String username, int windowDays, InconsistencyReport report, List<Long> scoreIds) {
        if (report.insufficientData()) {
            return new InconsistencyReportDTO(
                    username,
                    windowDays,
                    report.totalSamplesInWindow(),
                    0,
                    null,
                    null,
                    null,
                    false,
                    true,
                    String.format("Insufficient scores in the last %d days", windowDays),
                    List.of());
        }

        List<TransitionDTO> transitions =
                report.transitions().stream()
                        .map(
                                t ->
                                        new TransitionDTO(
                                                t.index(),
                                                t.fromValue(),
                                                t.toValue(),
                                                t.change(),
                                                t.fromTimestamp(),
                                                t.toTimestamp(),
                                                scoreIds.get(t.index()),
                                                scoreIds.get(t.index() + 1)))
                        .toList();

        return new InconsistencyReportDTO(
                username,
                windowDays,
                report.totalSamplesInWindow(),
                report.inconsistentTransitionCount(),
                report.meanAbsChange(),
                report.stdAbsChange(),
                report.coefficientOfVariation(),
                report.highlyInconsistent(),
                false,
                null,
                transitions);
    }

    /**
     * One abnormally large jump between consecutive scores.
     */
    @Schema(description = "Jump between two consecutive scores")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TransitionDTO(
            @Schema(description = "Position of the earlier score") Integer index,
            @Schema(description = "Score before the jump") Double fromValue,
            @Schema(description = "Score after the jump") Double toValue,
            @Schema(description = "Signed change") Double change,
            @Schema(description = "Timestamp of the earlier score") Instant fromTimestamp,
            @Schema(description = "Timestamp of the later score") Instant toTimestamp,
            @Schema(description = "Stored id of the earlier score") Long fromScoreId,
            @Schema(description = "Stored id of the later score") Long toScoreId) {}
}
