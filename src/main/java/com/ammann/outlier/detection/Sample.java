/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.exception.MalformedInputException;
import java.time.Instant;

/**
 * One observation of a score series.
 *
 * @param value the numeric score, always finite
 * @param id optional caller identifier (for example the stored score id), may be {@code null}
 * @param timestamp optional acquisition time, may be {@code null}
 */
public record Sample(double value, String id, Instant timestamp) {

    public Sample {
        if (!Double.isFinite(value)) {
            throw new MalformedInputException("Sample value must be a finite number, got " + value);
        }
    }

    public static Sample of(double value) {
        return new Sample(value, null, null);
    }

    /**
     * Creates a sample from a boxed value as read from storage.
     *
     * @throws MalformedInputException if the value is {@code null} or not finite
     */
    public static Sample of(Number value, String id, Instant timestamp) {
        if (value == null) {
            throw new MalformedInputException(
                    "Sample value must be a finite number, got null (id=" + id + ")");
        }
        return new Sample(value.doubleValue(), id, timestamp);
    }
}
