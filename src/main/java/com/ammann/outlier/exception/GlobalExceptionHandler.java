/* (C)2026 */
package com.ammann.outlier.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.time.LocalDateTime;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Malformed score data is reported as a data-quality error (422) so that callers can
 * tell it apart from an analysis that simply found no outliers. Unhandled exceptions are
 * logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception> {
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    static final int UNPROCESSABLE_ENTITY = 422;

    @Context UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception) {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST.getStatusCode(),
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path);
        }

        if (exception instanceof MalformedInputException) {
            LOG.warnf("Rejected malformed score data for path %s: %s", path, exception.getMessage());
            return createResponse(
                    UNPROCESSABLE_ENTITY, exception.getMessage(), "DATA_QUALITY_ERROR", path);
        }

        if (exception instanceof ScoreNotFoundException || exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND.getStatusCode(),
                    exception.getMessage(),
                    "NOT_FOUND",
                    path);
        }

        if (exception instanceof ApiException) {
            LOG.warnf("Application error for path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                    exception.getMessage(),
                    "INTERNAL_ERROR",
                    path);
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path);
    }

    private Response createResponse(int status, String message, String code, String path) {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status);
        return Response.status(status).entity(errorResponse).build();
    }

    /**
     * Structured error response body returned to API clients.
     */
    public static class ErrorResponse {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String message) {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status) {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
