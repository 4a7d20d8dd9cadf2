package com.fintech.marketfeed.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Uniform error body for every failed API call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "404")
    int status,

    @Schema(description = "Error category", example = "UNKNOWN_EXCHANGE")
    String error,

    @Schema(description = "Human-readable error message", example = "Unknown or unconfigured exchange: foo")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/exchanges/foo/market-data")
    String path,

    @Schema(description = "Timestamp of the error", example = "2025-12-09T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Parameter-level validation errors (if applicable)")
    List<ValidationError> validationErrors
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<ValidationError> validationErrors) {
        this(status, error, message, path, Instant.now(), validationErrors);
    }

    @Schema(description = "Parameter-level validation error")
    public record ValidationError(
        @Schema(description = "Parameter that failed validation", example = "symbol")
        String field,

        @Schema(description = "Rejected value", example = " ")
        String rejectedValue,

        @Schema(description = "Validation error message", example = "Symbol is required")
        String message
    ) {}
}
