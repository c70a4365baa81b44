/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.enumeration.DetectionMethod;

/**
 * A univariate outlier detector that votes in the ensemble.
 *
 * <p>Implementations are immutable and stateless: {@link #detect(SampleSeries)} is a pure
 * function of the series and the parameter the detector was built with, so one instance
 * may be shared across threads. Short or degenerate series yield an empty
 * {@link MethodResult}, never an exception.
 */
public interface OutlierMethod {

    DetectionMethod method();

    /** Smallest series length the method will score. */
    int minimumSamples();

    MethodResult detect(SampleSeries series);
}
