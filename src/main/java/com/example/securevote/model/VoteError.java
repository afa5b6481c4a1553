package com.example.securevote.model;

import lombok.Getter;

/**
 * Distinguishable failure kinds returned by the voting core.
 * Token and state errors are final for the given input; STORAGE_UNAVAILABLE is retryable.
 */
@Getter
public enum VoteError {
    INVALID_TOKEN(401, "Invalid token"),
    EXPIRED(400, "Token expired"),
    ALREADY_USED(409, "Token already used"),
    ALREADY_VOTED(409, "Already voted"),
    CHAIN_BROKEN(409, "Audit chain broken"),
    STORAGE_UNAVAILABLE(503, "Storage unavailable, retry later"),
    ELECTION_NOT_OPEN(409, "Election is not open"),
    ELECTION_NOT_CLOSED(403, "Election must be closed"),
    UNKNOWN_ELECTION(404, "Election not found"),
    MALFORMED_REQUEST(400, "Malformed request");

    private final int httpStatus;
    private final String defaultMessage;

    VoteError(int httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    /**
     * Only storage failures may be retried with the same input; tokens are single-use.
     */
    public boolean isRetryable() {
        return this == STORAGE_UNAVAILABLE;
    }
}
