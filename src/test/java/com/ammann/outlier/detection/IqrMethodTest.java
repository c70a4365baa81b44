/* (C)2026 */
package com.ammann.outlier.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.outlier.enumeration.DetectionMethod;
import com.ammann.outlier.enumeration.ResultStatus;
import com.ammann.outlier.exception.ValidationException;
import com.ammann.outlier.support.TestDataFactory;
import org.junit.jupiter.api.Test;

class IqrMethodTest {

    private final IqrMethod method = new IqrMethod();

    @Test
    void flagsValuesOutsideTukeyFences() {
        MethodResult result = method.detect(TestDataFactory.spikedSeries());

        assertThat(result.method()).isEqualTo(DetectionMethod.IQR);
        assertThat(result.outlierIndices()).containsExactly(8, 9);
        assertThat(result.outlierValues()).containsExactly(150.0, 22.0);
        assertThat(result.diagnostics())
                .containsEntry("q1", 24.0)
                .containsEntry("q3", 25.0)
                .containsEntry("iqr", 1.0)
                .containsEntry("lower_bound", 22.5)
                .containsEntry("upper_bound", 26.5)
                .containsEntry("iqr_multiplier", 1.5);
        assertThat(result.sampleScores()).isEmpty();
    }

    @Test
    void detectsLowOutlier() {
        MethodResult result = method.detect(SampleSeries.of(-50, 10, 20, 30, 40, 50));

        assertThat(result.outlierIndices()).containsExactly(0);
    }

    @Test
    void valueOnTheFenceIsNotFlagged() {
        // q1 = 2.25, q3 = 4.75, upper fence = 8.5
        MethodResult result = method.detect(SampleSeries.of(1, 2, 3, 4, 5, 8.5));

        assertThat(result.diagnostics().get("upper_bound")).isEqualTo(8.5);
        assertThat(result.outlierIndices()).isEmpty();
    }

    @Test
    void widerMultiplierFlagsLess() {
        IqrMethod wide = new IqrMethod(3.0);

        MethodResult result = wide.detect(TestDataFactory.spikedSeries());

        assertThat(wide.multiplier()).isEqualTo(3.0);
        assertThat(result.outlierIndices()).containsExactly(8);
    }

    @Test
    void needsFourSamples() {
        assertThat(method.minimumSamples()).isEqualTo(4);

        MethodResult result = method.detect(SampleSeries.of(1, 2, 100));

        assertThat(result.status()).isEqualTo(ResultStatus.INSUFFICIENT_DATA);
        assertThat(result.outlierIndices()).isEmpty();
    }

    @Test
    void constantSeriesFlagsNothing() {
        MethodResult result = method.detect(SampleSeries.of(5, 5, 5, 5, 5));

        assertThat(result.status()).isEqualTo(ResultStatus.COMPLETED);
        assertThat(result.outlierIndices()).isEmpty();
    }

    @Test
    void rejectsNonPositiveMultiplier() {
        assertThatThrownBy(() -> new IqrMethod(0.0)).isInstanceOf(ValidationException.class);
    }
}
