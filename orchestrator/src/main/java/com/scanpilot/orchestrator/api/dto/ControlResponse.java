package com.scanpilot.orchestrator.api.dto;

/** Outcome of an operator action (pause, resume, cancel, delete, tool changes). */
public record ControlResponse(boolean success, String message) {

    public static ControlResponse of(boolean success, String ok, String notOk) {
        return new ControlResponse(success, success ? ok : notOk);
    }
}
