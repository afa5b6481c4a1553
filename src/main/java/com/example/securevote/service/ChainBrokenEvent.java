package com.example.securevote.service;

/**
 * Published when chain verification fails. Consumed by {@link AuditAlertListener}.
 */
public class ChainBrokenEvent {

    private final String electionId;
    private final long brokenAt;

    public ChainBrokenEvent(String electionId, long brokenAt) {
        this.electionId = electionId;
        this.brokenAt = brokenAt;
    }

    public String getElectionId() {
        return electionId;
    }

    public long getBrokenAt() {
        return brokenAt;
    }
}
