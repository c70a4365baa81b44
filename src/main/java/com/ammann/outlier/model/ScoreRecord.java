/* (C)2026 */
package com.ammann.outlier.model;

import com.ammann.outlier.detection.Sample;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

@Entity
@Table(
        name = ScoreRecord.TABLE_NAME,
        indexes = {
            @Index(name = "idx_score_username_timestamp", columnList = "username, taken_at"),
            @Index(name = "idx_score_agegroup_score", columnList = "detailed_age_group, total_score"),
            @Index(name = "idx_score_taken_at", columnList = "taken_at")
        })
public class ScoreRecord {
    public static final String TABLE_NAME = "scores";

    @Id @GeneratedValue public Long id;

    /**
     * Owner of the assessment.
     */
    @Column(nullable = false, length = 128)
    @NotNull
    public String username;

    /**
     * Total assessment score. Nullable at the storage level; a missing value is rejected
     * as malformed input when the score enters an analysis.
     */
    @Column(name = "total_score")
    public Double totalScore;

    /**
     * Age of the user when the assessment was taken.
     */
    @Column
    public Integer age;

    /**
     * Detailed age cohort label, for example "18-25".
     */
    @Column(name = "detailed_age_group", length = 32)
    public String detailedAgeGroup;

    /**
     * Time the assessment was completed. Analyses order scores by this column.
     */
    @Column(name = "taken_at", nullable = false)
    @NotNull
    public Instant takenAt;

    public ScoreRecord() {
        this.takenAt = Instant.now();
    }

    public ScoreRecord(String username, Double totalScore, Instant takenAt) {
        this.username = username;
        this.totalScore = totalScore;
        this.takenAt = takenAt;
    }

    /**
     * Converts this record into an engine sample carrying the record id and timestamp.
     *
     * @throws com.ammann.outlier.exception.MalformedInputException if the score is missing
     */
    public Sample toSample() {
        return Sample.of(totalScore, id != null ? id.toString() : null, takenAt);
    }

    @Override
    public String toString() {
        return "ScoreRecord{id=" + id + ", username='" + username + "', totalScore=" + totalScore
                + ", ageGroup='" + detailedAgeGroup + "', takenAt=" + takenAt + "}";
    }
}
