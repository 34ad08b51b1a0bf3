package com.scanpilot.orchestrator.ai;

public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }
}
