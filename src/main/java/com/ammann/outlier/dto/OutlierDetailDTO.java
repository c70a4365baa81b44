/* (C)2026 */
package com.ammann.outlier.dto;

import com.ammann.outlier.model.ScoreRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * A flagged score mapped back from its series position to the stored record.
 *
 * @param index position of the score in the analysed series
 * @param scoreId id of the stored score
 * @param username owner of the score
 * @param scoreValue total score
 * @param age age of the user at assessment time
 * @param ageGroup detailed age group
 * @param timestamp assessment time
 * @param votes ensemble votes the score received, {@code null} for single-method analyses
 */
@Schema(description = "Stored score flagged as an outlier")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutlierDetailDTO(
        @Schema(description = "Position in the analysed series") Integer index,
        @Schema(description = "Stored score id") Long scoreId,
        @Schema(description = "Owner of the score") String username,
        @Schema(description = "Total score value") Double scoreValue,
        @Schema(description = "Age at assessment time") Integer age,
        @Schema(description = "Detailed age group") String ageGroup,
        @Schema(description = "Assessment timestamp") Instant timestamp,
        @Schema(description = "Ensemble votes received") Integer votes) {

    public static OutlierDetailDTO of(int index, ScoreRecord record, Integer votes) {
        return new OutlierDetailDTO(
                index,
                record.id,
                record.username,
                record.totalScore,
                record.age,
                record.detailedAgeGroup,
                record.takenAt,
                votes);
    }
}
