package com.mqol.teamservice.domain;

/**
 * Thrown when a write would violate a uniqueness rule (duplicate slug, existing membership).
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
