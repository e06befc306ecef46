package com.fintech.trades.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps exceptions raised by the trade API to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Bean validation failures on request parameters (e.g. negative count).
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        List<ErrorResponse.FieldError> fieldErrors = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.FieldError(
                parameterName(violation),
                String.valueOf(violation.getInvalidValue()),
                violation.getMessage()))
            .toList();

        String path = path(request);
        log.warn("Validation error on {}: {}", path, fieldErrors);
        return ResponseEntity.badRequest().body(ErrorResponse.of(
            HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", path, fieldErrors));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(
            HandlerMethodValidationException ex,
            WebRequest request) {

        String path = path(request);
        log.warn("Validation error on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(
            HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", path));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {

        String path = path(request);
        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(ErrorResponse.of(
            HttpStatus.BAD_REQUEST,
            "MISSING_PARAMETER",
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            path,
            List.of(new ErrorResponse.FieldError(ex.getParameterName(), null, "This parameter is required"))));
    }

    /**
     * Unparseable parameters, e.g. a timestamp that is not ISO-8601.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = path(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        log.warn("Type mismatch on {}: {} expected {} but got {}", path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(ErrorResponse.of(
            HttpStatus.BAD_REQUEST,
            "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType),
            path,
            List.of(new ErrorResponse.FieldError(
                ex.getName(), String.valueOf(ex.getValue()), "Expected type: " + expectedType))));
    }

    /**
     * Unsupported symbols and out-of-range counts.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request) {

        String path = path(request);
        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(
            HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), path));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = path(request);
        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_ERROR",
            "An unexpected error occurred",
            path));
    }

    private static String path(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private static String parameterName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
