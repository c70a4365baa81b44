/* (C)2026 */
package com.ammann.outlier.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.outlier.enumeration.ResultStatus;
import com.ammann.outlier.exception.ValidationException;
import com.ammann.outlier.support.TestDataFactory;
import org.junit.jupiter.api.Test;

class ZScoreMethodTest {

    private final ZScoreMethod method = new ZScoreMethod();

    @Test
    void flagsOnlyTheExtremeScore() {
        MethodResult result = method.detect(TestDataFactory.spikedSeries());

        assertThat(result.status()).isEqualTo(ResultStatus.COMPLETED);
        assertThat(result.outlierIndices()).containsExactly(8);
        assertThat(result.outlierValues()).containsExactly(150.0);
        assertThat(result.diagnostics().get("mean")).isEqualTo(34.0);
        assertThat(result.diagnostics().get("std_dev")).isCloseTo(33.5054531, within(1e-6));
        assertThat(result.diagnostics().get("threshold")).isEqualTo(2.5);
    }

    @Test
    void reportsAbsoluteZScorePerSample() {
        MethodResult result = method.detect(SampleSeries.of(10, 20, 30, 40, 50));

        assertThat(result.sampleScores()).hasSize(5);
        assertThat(result.sampleScores().get(0)).isCloseTo(Math.sqrt(2.0), within(1e-9));
        assertThat(result.sampleScores().get(2)).isZero();
        assertThat(result.hasOutliers()).isFalse();
    }

    @Test
    void masksOutlierInSmallSample() {
        // 100 inflates the standard deviation enough to hide itself
        MethodResult result = method.detect(SampleSeries.of(1, 2, 3, 4, 5, 100));

        assertThat(result.outlierIndices()).isEmpty();
    }

    @Test
    void lowerThresholdFlagsMore() {
        MethodResult result = new ZScoreMethod(2.0).detect(SampleSeries.of(1, 2, 3, 4, 5, 100));

        assertThat(result.outlierIndices()).containsExactly(5);
    }

    @Test
    void constantSeriesIsDegenerate() {
        MethodResult result = method.detect(SampleSeries.of(7, 7, 7, 7));

        assertThat(result.status()).isEqualTo(ResultStatus.DEGENERATE_DISTRIBUTION);
        assertThat(result.outlierIndices()).isEmpty();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void singleSampleIsInsufficient() {
        MethodResult result = method.detect(SampleSeries.of(42));

        assertThat(result.status()).isEqualTo(ResultStatus.INSUFFICIENT_DATA);
        assertThat(result.outlierCount()).isZero();
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new ZScoreMethod(0.0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new ZScoreMethod(-1.0)).isInstanceOf(ValidationException.class);
    }
}
