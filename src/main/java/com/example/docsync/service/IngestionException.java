package com.example.docsync.service;

/**
 * Raised when an uploaded bundle cannot be turned into analysis input
 * (unreadable archive, limits exceeded, nothing usable inside).
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
