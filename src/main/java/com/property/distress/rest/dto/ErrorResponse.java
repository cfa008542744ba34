package com.property.distress.rest.dto;

import jakarta.ws.rs.core.Response;

import java.time.Instant;

/**
 * Error body returned by every endpoint. {@code error} is the HTTP reason phrase.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp
) {
    public static ErrorResponse of(Response.Status status, String message, String path) {
        return new ErrorResponse(status.getStatusCode(), status.getReasonPhrase(), message, path, Instant.now());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return of(Response.Status.BAD_REQUEST, message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return of(Response.Status.NOT_FOUND, message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return of(Response.Status.INTERNAL_SERVER_ERROR, message, path);
    }
}
