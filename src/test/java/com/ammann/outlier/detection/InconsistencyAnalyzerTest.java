/* (C)2026 */
package com.ammann.outlier.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.outlier.support.TestDataFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;

class InconsistencyAnalyzerTest {

    private final InconsistencyAnalyzer analyzer = new InconsistencyAnalyzer();

    @Test
    void flagsTheJumpToANewPlateau() {
        InconsistencyReport report =
                analyzer.analyze(SampleSeries.of(TestDataFactory.PLATEAU_SHIFT_SCORES));

        assertThat(report.insufficientData()).isFalse();
        assertThat(report.totalSamplesInWindow()).isEqualTo(12);
        assertThat(report.inconsistentTransitionCount()).isEqualTo(1);
        assertThat(report.meanAbsChange()).isCloseTo(4.7272727, within(1e-6));
        assertThat(report.stdAbsChange()).isCloseTo(10.8467918, within(1e-6));
        assertThat(report.coefficientOfVariation()).isCloseTo(47.7130677, within(1e-6));
        assertThat(report.highlyInconsistent()).isTrue();

        InconsistencyReport.Transition transition = report.transitions().get(0);
        assertThat(transition.index()).isEqualTo(5);
        assertThat(transition.fromValue()).isEqualTo(21.0);
        assertThat(transition.toValue()).isEqualTo(60.0);
        assertThat(transition.change()).isEqualTo(39.0);
    }

    @Test
    void changeKeepsItsSign() {
        double[] falling = {60, 61, 60, 62, 61, 60, 21, 20, 22, 21, 23, 22};

        InconsistencyReport report = analyzer.analyze(SampleSeries.of(falling));

        assertThat(report.transitions()).singleElement().satisfies(t -> {
            assertThat(t.index()).isEqualTo(5);
            assertThat(t.change()).isEqualTo(-39.0);
        });
    }

    @Test
    void stableHistoryHasNoTransitions() {
        InconsistencyReport report =
                analyzer.analyze(SampleSeries.of(20, 22, 21, 23, 22, 21, 23, 22));

        assertThat(report.inconsistentTransitionCount()).isZero();
        assertThat(report.coefficientOfVariation()).isCloseTo(4.4517050, within(1e-6));
        assertThat(report.highlyInconsistent()).isFalse();
    }

    @Test
    void shortHistoryCannotFlagASingleSpike() {
        // With three differences no value can exceed mean + 2 * std
        InconsistencyReport report = analyzer.analyze(SampleSeries.of(20, 22, 75, 24));

        assertThat(report.inconsistentTransitionCount()).isZero();
        assertThat(report.meanAbsChange()).isCloseTo(35.3333333, within(1e-6));
        assertThat(report.coefficientOfVariation()).isCloseTo(65.2289518, within(1e-6));
        assertThat(report.highlyInconsistent()).isTrue();
    }

    @Test
    void identicalPairHasZeroSpread() {
        InconsistencyReport report = analyzer.analyze(SampleSeries.of(50, 50));

        assertThat(report.inconsistentTransitionCount()).isZero();
        assertThat(report.meanAbsChange()).isZero();
        assertThat(report.stdAbsChange()).isZero();
        assertThat(report.coefficientOfVariation()).isZero();
    }

    @Test
    void zeroMeanReportsZeroVariation() {
        InconsistencyReport report = analyzer.analyze(SampleSeries.of(-5, 5, -5, 5));

        assertThat(report.coefficientOfVariation()).isZero();
        assertThat(report.highlyInconsistent()).isFalse();
    }

    @Test
    void fewerThanTwoSamplesIsInsufficient() {
        InconsistencyReport report = analyzer.analyze(SampleSeries.of(42));

        assertThat(report.insufficientData()).isTrue();
        assertThat(report.totalSamplesInWindow()).isEqualTo(1);
        assertThat(report.transitions()).isEmpty();
    }

    @Test
    void transitionsCarrySampleTimestamps() {
        Instant base = Instant.parse("2025-01-01T00:00:00Z");
        List<Sample> samples = new ArrayList<>();
        double[] values = TestDataFactory.PLATEAU_SHIFT_SCORES;
        for (int i = 0; i < values.length; i++) {
            samples.add(Sample.of(values[i], String.valueOf(i), base.plusSeconds(i * 3600L)));
        }

        InconsistencyReport report = analyzer.analyze(SampleSeries.of(samples));

        InconsistencyReport.Transition transition = report.transitions().get(0);
        assertThat(transition.fromTimestamp()).isEqualTo(base.plusSeconds(5 * 3600L));
        assertThat(transition.toTimestamp()).isEqualTo(base.plusSeconds(6 * 3600L));
    }

    @Test
    void lowerSigmaMultiplierFlagsMoreJumps() {
        InconsistencyAnalyzer sensitive = new InconsistencyAnalyzer(0.5, 30.0);

        InconsistencyReport report =
                sensitive.analyze(SampleSeries.of(20, 22, 21, 23, 22, 21, 23, 22));

        assertThat(report.inconsistentTransitionCount()).isPositive();
    }

    @Test
    void debugSummaryIsWrittenWithoutAffectingTheReport() {
        Logger logger = Logger.getLogger(InconsistencyAnalyzer.class.getName());
        Level previous = logger.getLevel();
        logger.setLevel(Level.FINE);
        try {
            InconsistencyReport report =
                    analyzer.analyze(SampleSeries.of(TestDataFactory.PLATEAU_SHIFT_SCORES));

            assertThat(report.inconsistentTransitionCount()).isEqualTo(1);
            assertThat(report.coefficientOfVariation()).isCloseTo(47.7130677, within(1e-6));
        } finally {
            logger.setLevel(previous);
        }
    }
}
