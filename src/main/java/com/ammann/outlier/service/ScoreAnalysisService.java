/* (C)2026 */
package com.ammann.outlier.service;

import com.ammann.outlier.detection.DetectionResult;
import com.ammann.outlier.detection.EnsembleResult;
import com.ammann.outlier.detection.InconsistencyReport;
import com.ammann.outlier.detection.SampleSeries;
import com.ammann.outlier.dto.DetectionResultDTO;
import com.ammann.outlier.dto.InconsistencyReportDTO;
import com.ammann.outlier.dto.OutlierDetailDTO;
import com.ammann.outlier.dto.OutlierReportDTO;
import com.ammann.outlier.dto.ScoreStatisticsDTO;
import com.ammann.outlier.enumeration.AnalysisScope;
import com.ammann.outlier.enumeration.DetectionMethod;
import com.ammann.outlier.exception.ScoreNotFoundException;
import com.ammann.outlier.exception.ValidationException;
import com.ammann.outlier.model.ScoreRecord;
import com.ammann.outlier.model.ScoreRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Analysis facade over stored assessment scores.
 *
 * <p>Loads the score population for a user, an age group or everyone from the
 * {@link ScoreRepository}, hands the chronologically ordered series to the
 * {@link OutlierDetectionService} and maps flagged positions back to the stored records.
 * The facade owns no statistics of its own beyond descriptive summaries.
 */
@ApplicationScoped
public class ScoreAnalysisService {

    private static final Logger LOG = Logger.getLogger(ScoreAnalysisService.class);

    public static final int DEFAULT_WINDOW_DAYS = 30;
    public static final int MAX_WINDOW_DAYS = 3650;

    static final String ANALYSES_COUNTER = "outlier_analyses_total";
    static final String FLAGGED_COUNTER = "outlier_flagged_scores_total";

    ScoreRepository scoreRepository;
    OutlierDetectionService detectionService;
    MeterRegistry meterRegistry;

    @ConfigProperty(name = "outlier.inconsistency.window-days", defaultValue = "30")
    int windowDays = DEFAULT_WINDOW_DAYS;

    @Inject
    public ScoreAnalysisService(
            ScoreRepository scoreRepository,
            OutlierDetectionService detectionService,
            MeterRegistry meterRegistry) {
        this.scoreRepository = scoreRepository;
        this.detectionService = detectionService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Detects outliers in one user's score history.
     *
     * @throws ScoreNotFoundException if the user has no scores
     */
    public OutlierReportDTO analyzeUser(String username, DetectionMethod method) {
        List<ScoreRecord> scores = scoreRepository.findByUsername(username);
        if (scores.isEmpty()) {
            LOG.warnf("Outlier analysis requested for user without scores: %s", username);
            throw ScoreNotFoundException.forUser(username);
        }
        return analyze(AnalysisScope.USER, username, scores, method, false);
    }

    /**
     * Detects outliers among all scores of a detailed age group.
     *
     * @throws ScoreNotFoundException if the age group has no scores
     */
    public OutlierReportDTO analyzeAgeGroup(String ageGroup, DetectionMethod method) {
        List<ScoreRecord> scores = scoreRepository.findByAgeGroup(ageGroup);
        if (scores.isEmpty()) {
            LOG.warnf("Outlier analysis requested for empty age group: %s", ageGroup);
            throw ScoreNotFoundException.forAgeGroup(ageGroup);
        }
        return analyze(AnalysisScope.AGE_GROUP, ageGroup, scores, method, true);
    }

    /**
     * Detects outliers across every stored score.
     *
     * @throws ScoreNotFoundException if no scores are stored
     */
    public OutlierReportDTO analyzeGlobal(DetectionMethod method) {
        List<ScoreRecord> scores = scoreRepository.findAllOrdered();
        if (scores.isEmpty()) {
            LOG.warn("Global outlier analysis requested but no scores are stored");
            throw ScoreNotFoundException.global();
        }
        return analyze(AnalysisScope.GLOBAL, null, scores, method, true);
    }

    /** Inconsistency analysis over the configured default window. */
    public InconsistencyReportDTO analyzeInconsistency(String username) {
        return analyzeInconsistency(username, windowDays);
    }

    /**
     * Looks for abnormally large jumps in a user's scores of the last {@code windowDays}
     * days. Fewer than two scores in the window yield a report flagged as insufficient
     * data rather than an error.
     *
     * @param username user to analyse
     * @param windowDays look-back window, {@code 1..3650}
     * @throws ValidationException if the window is out of range
     */
    public InconsistencyReportDTO analyzeInconsistency(String username, int windowDays) {
        if (windowDays < 1 || windowDays > MAX_WINDOW_DAYS) {
            throw ValidationException.invalidParameter(
                    "days", windowDays, "between 1 and " + MAX_WINDOW_DAYS);
        }

        Instant cutoff = Instant.now().minus(Duration.ofDays(windowDays));
        List<ScoreRecord> scores = scoreRepository.findByUsernameSince(username, cutoff);
        SampleSeries series = ScoreRepository.toSeries(scores);

        InconsistencyReport report = detectionService.detectInconsistency(series);
        LOG.debugf(
                "Inconsistency analysis for user=%s window=%dd: samples=%d, transitions=%d, cv=%.2f%%",
                username,
                windowDays,
                report.totalSamplesInWindow(),
                report.inconsistentTransitionCount(),
                report.coefficientOfVariation());

        List<Long> scoreIds = scores.stream().map(s -> s.id).toList();
        return InconsistencyReportDTO.from(username, windowDays, report, scoreIds);
    }

    /**
     * Descriptive statistics including quartiles for one age group, or for every stored
     * score when {@code ageGroup} is {@code null} or blank.
     *
     * @throws ScoreNotFoundException if the population is empty
     */
    public ScoreStatisticsDTO statisticalSummary(String ageGroup) {
        boolean global = ageGroup == null || ageGroup.isBlank();
        List<ScoreRecord> scores =
                global ? scoreRepository.findAllOrdered() : scoreRepository.findByAgeGroup(ageGroup);
        if (scores.isEmpty()) {
            throw global ? ScoreNotFoundException.global() : ScoreNotFoundException.forAgeGroup(ageGroup);
        }

        SampleSeries series = ScoreRepository.toSeries(scores);
        String scope = global ? AnalysisScope.GLOBAL.tag() : "age_group_" + ageGroup;
        return ScoreStatisticsDTO.withQuartiles(scope, series.values());
    }

    private OutlierReportDTO analyze(
            AnalysisScope scope,
            String subject,
            List<ScoreRecord> scores,
            DetectionMethod method,
            boolean includeStatistics) {
        SampleSeries series = ScoreRepository.toSeries(scores);
        DetectionResult result = detectionService.detect(method, series);

        List<OutlierDetailDTO> details = new ArrayList<>(result.outlierCount());
        for (int index : result.outlierIndices()) {
            Integer votes =
                    result instanceof EnsembleResult ensemble ? ensemble.votesFor(index) : null;
            details.add(OutlierDetailDTO.of(index, scores.get(index), votes));
        }

        ScoreStatisticsDTO statistics =
                includeStatistics ? ScoreStatisticsDTO.basic(null, series.values()) : null;

        recordAnalysis(scope, method, result.outlierCount());
        LOG.infof(
                "Outlier analysis scope=%s subject=%s method=%s: %d of %d scores flagged (%s)",
                scope.tag(),
                subject,
                method.key(),
                result.outlierCount(),
                series.size(),
                result.status());

        return new OutlierReportDTO(
                scope.tag(),
                subject,
                series.size(),
                result.outlierCount(),
                method.key(),
                details,
                statistics,
                DetectionResultDTO.from(result),
                Instant.now());
    }

    private void recordAnalysis(AnalysisScope scope, DetectionMethod method, int flagged) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder(ANALYSES_COUNTER)
                .description("Outlier analyses run over stored scores")
                .tag("scope", scope.tag())
                .tag("method", method.key())
                .register(meterRegistry)
                .increment();
        Counter.builder(FLAGGED_COUNTER)
                .description("Stored scores flagged as outliers")
                .tag("scope", scope.tag())
                .register(meterRegistry)
                .increment(flagged);
    }
}
