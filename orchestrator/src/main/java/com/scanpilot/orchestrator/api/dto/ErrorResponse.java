package com.scanpilot.orchestrator.api.dto;

/** Body of every error response. {@code error} is a stable code, {@code message} is for humans. */
public record ErrorResponse(boolean success, String error, String message) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(false, error, message);
    }
}
