package com.example.securevote.model;

/**
 * Election flag as recorded from the election-management layer.
 */
public enum ElectionStatus {
    OPEN,
    CLOSED
}
