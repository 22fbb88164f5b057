package com.autoya.backend.util;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for REST controllers.
 *
 * Service failures never reach this class; they come back as results and
 * are rendered by the controllers. What lands here:
 * - request validation failures (400, with per-field messages)
 * - unreadable bodies and malformed path/query parameters (400)
 * - framework rejections such as unknown routes (their own status)
 * - anything unexpected (500, logged with stack trace)
 *
 * @see com.autoya.backend.util.ErrorResponseFactory
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorResponseFactory errorResponseFactory;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.toList());

        log.warn("Validation failed: path={}, errors={}", request.getRequestURI(), errors);

        Map<String, Object> body = errorResponseFactory.createValidationErrorBody(
            "Validation failed: " + String.join("; ", errors),
            errors,
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        log.warn("Unreadable request body: {}", ex.getMessage());

        Map<String, Object> body = errorResponseFactory.createErrorBody(
            HttpStatus.BAD_REQUEST,
            "MALFORMED_REQUEST",
            "Request body is missing or is not valid JSON",
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        log.warn("Invalid parameter: name={}, value={}", ex.getName(), ex.getValue());

        Map<String, Object> body = errorResponseFactory.createErrorBody(
            HttpStatus.BAD_REQUEST,
            "MALFORMED_REQUEST",
            "Invalid value for parameter '" + ex.getName() + "'",
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        // Framework exceptions (unknown route, unsupported method, ...) carry their own status
        if (ex instanceof ErrorResponse) {
            HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
            log.warn("Request rejected: status={}, path={}", status.value(), request.getRequestURI());
            Map<String, Object> body = errorResponseFactory.createErrorBody(
                status,
                status.name(),
                status.getReasonPhrase(),
                request.getRequestURI()
            );
            return new ResponseEntity<>(body, status);
        }

        log.error("Unhandled exception", ex);

        Map<String, Object> body = errorResponseFactory.createErrorBody(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL",
            "An unexpected error occurred. Please contact support with correlation ID.",
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
