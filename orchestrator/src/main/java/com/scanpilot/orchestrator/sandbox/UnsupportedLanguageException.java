package com.scanpilot.orchestrator.sandbox;

/** Raised before anything is written or run when a verification job names an unknown language. */
public class UnsupportedLanguageException extends RuntimeException {

    private final String language;

    public UnsupportedLanguageException(String language) {
        super("Unsupported language: " + language);
        this.language = language;
    }

    public String getLanguage() { return language; }
}
