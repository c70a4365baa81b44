/* (C)2026 */
package com.ammann.outlier.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.outlier.dto.AnalyzeRequestDTO;
import com.ammann.outlier.dto.DetectionResultDTO;
import com.ammann.outlier.dto.InconsistencyReportDTO;
import com.ammann.outlier.dto.OutlierDetailDTO;
import com.ammann.outlier.dto.OutlierReportDTO;
import com.ammann.outlier.dto.ScoreStatisticsDTO;
import com.ammann.outlier.exception.MalformedInputException;
import com.ammann.outlier.exception.ScoreNotFoundException;
import com.ammann.outlier.exception.ValidationException;
import com.ammann.outlier.model.ScoreRepository;
import com.ammann.outlier.service.OutlierDetectionService;
import com.ammann.outlier.service.ScoreAnalysisService;
import com.ammann.outlier.support.TestDataFactory;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

@QuarkusTest
class OutlierResourceTest {

    @Inject ScoreRepository repository;

    @Inject ScoreAnalysisService analysisService;

    @Inject OutlierDetectionService detectionService;

    @Test
    @TestTransaction
    void analyzeUserReturnsFlaggedStoredScores() {
        repository.deleteAll();
        repository.persist(
                TestDataFactory.buildHistory("alice", "18-25", 0, TestDataFactory.SPIKED_SCORES));
        OutlierResource resource = buildResource();

        Response response = resource.analyzeUser("alice", "ensemble");
        OutlierReportDTO report = (OutlierReportDTO) response.getEntity();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(report.totalScores()).isEqualTo(13);
        assertThat(report.outlierDetails())
                .extracting(OutlierDetailDTO::scoreValue)
                .containsExactly(150.0, 22.0);
        assertThat(report.outlierDetails().get(0).username()).isEqualTo("alice");
        assertThat(report.outlierDetails().get(0).scoreId()).isNotNull();
    }

    @Test
    @TestTransaction
    void analyzeAgeGroupAndGlobalIncludeStatistics() {
        repository.deleteAll();
        repository.persist(TestDataFactory.buildHistory("alice", "18-25", 0, 20, 22, 21, 23));
        repository.persist(TestDataFactory.buildHistory("bob", "18-25", 0, 22, 100, 21, 23));
        OutlierResource resource = buildResource();

        OutlierReportDTO group =
                (OutlierReportDTO) resource.analyzeAgeGroup("18-25", "iqr").getEntity();
        OutlierReportDTO global = (OutlierReportDTO) resource.analyzeGlobal("iqr").getEntity();

        assertThat(group.outlierDetails()).extracting(OutlierDetailDTO::scoreValue).containsExactly(100.0);
        assertThat(group.statistics().count()).isEqualTo(8L);
        assertThat(global.subject()).isNull();
        assertThat(global.totalScores()).isEqualTo(8);
    }

    @Test
    @TestTransaction
    void unknownUserIsNotFound() {
        repository.deleteAll();
        OutlierResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyzeUser("ghost", "zscore"))
                .isInstanceOf(ScoreNotFoundException.class);
    }

    @Test
    void unknownMethodIsRejected() {
        OutlierResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyzeUser("alice", "grubbs"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("method");
    }

    @Test
    @TestTransaction
    void inconsistencyUsesDefaultWindow() {
        repository.deleteAll();
        repository.persist(
                TestDataFactory.buildHistory("bob", "26-35", 0, TestDataFactory.PLATEAU_SHIFT_SCORES));
        repository.persist(TestDataFactory.buildHistory("bob", "26-35", 60, 500));
        OutlierResource resource = buildResource();

        InconsistencyReportDTO report =
                (InconsistencyReportDTO) resource.analyzeInconsistency("bob", null).getEntity();

        assertThat(report.timeWindowDays()).isEqualTo(30);
        assertThat(report.totalScoresInWindow()).isEqualTo(12);
        assertThat(report.inconsistentTransitions()).isEqualTo(1);
        assertThat(report.inconsistencyDetails().get(0).fromScoreId()).isNotNull();
    }

    @Test
    @TestTransaction
    void inconsistencyWithoutRecentScoresIsInsufficient() {
        repository.deleteAll();
        repository.persist(TestDataFactory.buildHistory("carol", "18-25", 100, 10, 90));
        OutlierResource resource = buildResource();

        InconsistencyReportDTO report =
                (InconsistencyReportDTO) resource.analyzeInconsistency("carol", 7).getEntity();

        assertThat(report.insufficientData()).isTrue();
        assertThat(report.totalScoresInWindow()).isZero();
    }

    @Test
    void inconsistencyRejectsWindowOutOfRange() {
        OutlierResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyzeInconsistency("bob", 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.analyzeInconsistency("bob", 4000))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @TestTransaction
    void statisticsForAgeGroup() {
        repository.deleteAll();
        repository.persist(TestDataFactory.buildHistory("alice", "36-45", 0, 10, 20, 30, 40, 50));
        OutlierResource resource = buildResource();

        ScoreStatisticsDTO summary =
                (ScoreStatisticsDTO) resource.statisticalSummary("36-45").getEntity();

        assertThat(summary.mean()).isEqualTo(30.0);
        assertThat(summary.q1()).isEqualTo(20.0);
        assertThat(summary.q3()).isEqualTo(40.0);
    }

    @Test
    void analyzeSeriesRunsRequestedMethod() {
        OutlierResource resource = buildResource();

        DetectionResultDTO iqr =
                (DetectionResultDTO)
                        resource.analyzeSeries(
                                        new AnalyzeRequestDTO(
                                                List.of(1.0, 2.0, 3.0, 4.0, 5.0, 100.0),
                                                "iqr",
                                                null,
                                                null))
                                .getEntity();

        assertThat(iqr.method()).isEqualTo("iqr");
        assertThat(iqr.outlierIndices()).containsExactly(5);
    }

    @Test
    void analyzeSeriesAppliesConsensusOverride() {
        OutlierResource resource = buildResource();
        List<Double> values = List.of(1.0, 2.0, 3.0, 4.0, 5.0, 100.0);

        DetectionResultDTO unanimous =
                (DetectionResultDTO)
                        resource.analyzeSeries(new AnalyzeRequestDTO(values, null, null, 1.0))
                                .getEntity();
        DetectionResultDTO threeOfFour =
                (DetectionResultDTO)
                        resource.analyzeSeries(new AnalyzeRequestDTO(values, "ensemble", 9.9, 0.75))
                                .getEntity();

        assertThat(unanimous.outlierIndices()).isEmpty();
        assertThat(unanimous.votes()).containsExactly(0, 0, 0, 0, 0, 3);
        assertThat(threeOfFour.outlierIndices()).containsExactly(5);
    }

    @Test
    void analyzeSeriesValidatesBody() {
        OutlierResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyzeSeries(null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(
                        () ->
                                resource.analyzeSeries(
                                        new AnalyzeRequestDTO(Arrays.asList(1.0, null), "mad", null, null)))
                .isInstanceOf(MalformedInputException.class);
        assertThatThrownBy(
                        () ->
                                resource.analyzeSeries(
                                        new AnalyzeRequestDTO(List.of(1.0, 2.0), "zscore", -1.0, null)))
                .isInstanceOf(ValidationException.class);
    }

    private OutlierResource buildResource() {
        OutlierResource resource = new OutlierResource();
        resource.analysisService = analysisService;
        resource.detectionService = detectionService;
        return resource;
    }
}
