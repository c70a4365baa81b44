/* (C)2026 */
package com.ammann.outlier.exception;

/**
 * Base unchecked exception for all application-level errors in the score outlier API.
 *
 * <p>Subclasses represent specific error categories (invalid parameters, malformed score
 * data, missing scores) and are mapped to appropriate HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException {
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
