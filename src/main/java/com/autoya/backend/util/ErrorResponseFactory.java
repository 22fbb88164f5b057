package com.autoya.backend.util;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import com.autoya.backend.result.ServiceError;

import lombok.RequiredArgsConstructor;

/**
 * Builds the error body shared by controllers and the global exception
 * handler.
 *
 * Error response format:
 * <pre>
 * {
 *   "timestamp": "2025-11-16T10:30:00Z",
 *   "status": 400,
 *   "error": "Bad Request",
 *   "code": "NOT_FOUND",
 *   "message": "Vehiculo not found.",
 *   "path": "/api/v1/vehiculos/99",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000"
 * }
 * </pre>
 * Validation failures add an {@code errors} array with one entry per field.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseFactory {

    private final ErrorStatusMapper errorStatusMapper;
    private final MetricsHelper metricsHelper;

    /**
     * Converts a service failure into a response, using the configured status
     * mapping.
     *
     * @param error the service error
     * @param path the request path
     * @return error response
     */
    public ResponseEntity<Object> fromServiceError(ServiceError error, String path) {
        HttpStatus status = errorStatusMapper.statusFor(error.kind());
        Map<String, Object> body = createErrorBody(status, error.kind().name(), error.message(), path);
        if (!error.context().isEmpty()) {
            body.put("details", error.context());
        }
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Creates a standardized error response body and counts it.
     *
     * @param status the HTTP status
     * @param code machine-readable error code
     * @param message the error message
     * @param path the request path
     * @return error response map
     */
    public Map<String, Object> createErrorBody(HttpStatus status, String code, String message, String path) {
        metricsHelper.recordApiError(code, status.value());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        body.put("path", path);
        body.put("correlationId", CorrelationIdFilter.getCurrentCorrelationId());
        return body;
    }

    /**
     * Same as {@link #createErrorBody} with the per-field messages attached.
     */
    public Map<String, Object> createValidationErrorBody(String message, List<String> errors, String path) {
        Map<String, Object> body = createErrorBody(HttpStatus.BAD_REQUEST, "VALIDATION", message, path);
        body.put("errors", errors);
        return body;
    }
}
