/* (C)2026 */
package com.ammann.outlier.exception;

/**
 * Exception indicating that a score series contains a null or non-finite value.
 *
 * <p>This is a data-quality failure upstream of the detection engine, not an analysis
 * result: series that are merely too short or have zero spread never raise it.
 * Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}.
 */
public class MalformedInputException extends ApiException {

    public MalformedInputException(String message) {
        super(message);
    }

    /**
     * Creates an exception for the offending sample position.
     */
    public static MalformedInputException atIndex(int index, Object value) {
        return new MalformedInputException(
                String.format(
                        "Malformed sample at index %d: expected a finite number, got '%s'",
                        index, value));
    }
}
