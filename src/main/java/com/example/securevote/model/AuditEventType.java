package com.example.securevote.model;

/**
 * Security-relevant state transitions recorded in the audit ledger.
 */
public enum AuditEventType {
    ELECTION_OPENED,
    VOTERS_IMPORTED,
    VOTER_AUTHENTICATED,
    BALLOT_TOKEN_ISSUED,
    BALLOT_CAST,
    ELECTION_CLOSED;

    public static boolean isKnown(String name) {
        if (name == null) {
            return false;
        }
        for (AuditEventType type : values()) {
            if (type.name().equals(name)) {
                return true;
            }
        }
        return false;
    }
}
