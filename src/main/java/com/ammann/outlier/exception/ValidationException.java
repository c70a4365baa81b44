/* (C)2026 */
package com.ammann.outlier.exception;

/**
 * Exception indicating that a client-supplied parameter does not meet the constraints of
 * the requested analysis (unknown method name, non-positive threshold, consensus fraction
 * outside {@code (0, 1]}, window out of range).
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format(
                        "Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
