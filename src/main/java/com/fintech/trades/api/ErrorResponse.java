package com.fintech.trades.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint of the trade API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error category", example = "INVALID_ARGUMENT")
    String error,

    @Schema(description = "Human-readable error message", example = "Unsupported symbol 'XRP-USD'")
    String message,

    @Schema(description = "Request path", example = "/api/v1/trades")
    String path,

    @Schema(description = "Time the error was produced", example = "2026-10-17T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Per-parameter errors, when the request failed validation")
    List<FieldError> fieldErrors
) {

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status.value(), error, message, path, Instant.now(), null);
    }

    public static ErrorResponse of(HttpStatus status, String error, String message, String path,
                                   List<FieldError> fieldErrors) {
        return new ErrorResponse(status.value(), error, message, path, Instant.now(), fieldErrors);
    }

    /** A single rejected request parameter. */
    @Schema(description = "Rejected request parameter")
    public record FieldError(
        @Schema(description = "Parameter name", example = "count")
        String field,

        @Schema(description = "Rejected value", example = "-1")
        String rejectedValue,

        @Schema(description = "Reason", example = "must be greater than or equal to 0")
        String message
    ) {}
}
