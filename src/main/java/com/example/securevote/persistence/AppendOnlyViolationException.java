package com.example.securevote.persistence;

/**
 * Raised when code attempts to modify or remove a committed append-only record.
 */
public class AppendOnlyViolationException extends RuntimeException {

    public AppendOnlyViolationException(String message) {
        super(message);
    }
}
