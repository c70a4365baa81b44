/* (C)2026 */
package com.ammann.outlier.model;

import com.ammann.outlier.detection.SampleSeries;
import io.quarkus.hibernate.orm.panache.PanacheRepository;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.List;

/**
 * Score repository supplying ordered score histories to the analysis facade.
 *
 * <p>Every finder returns scores ascending by timestamp (ties broken by id), which is the
 * order the detection engine analyses them in.
 */
@ApplicationScoped
public class ScoreRepository implements PanacheRepository<ScoreRecord> {

    private static final Sort CHRONOLOGICAL = Sort.ascending("takenAt", "id");

    public List<ScoreRecord> findByUsername(String username) {
        return list("username = ?1", CHRONOLOGICAL, username);
    }

    /**
     * Scores of one user taken at or after {@code cutoff}.
     */
    public List<ScoreRecord> findByUsernameSince(String username, Instant cutoff) {
        return list("username = ?1 and takenAt >= ?2", CHRONOLOGICAL, username, cutoff);
    }

    public List<ScoreRecord> findByAgeGroup(String ageGroup) {
        return list("detailedAgeGroup = ?1", CHRONOLOGICAL, ageGroup);
    }

    public List<ScoreRecord> findAllOrdered() {
        return listAll(CHRONOLOGICAL);
    }

    /**
     * Builds an engine series from records, keeping their order.
     *
     * @throws com.ammann.outlier.exception.MalformedInputException if a record has no score
     */
    public static SampleSeries toSeries(List<ScoreRecord> records) {
        return SampleSeries.of(records.stream().map(ScoreRecord::toSample).toList());
    }
}
