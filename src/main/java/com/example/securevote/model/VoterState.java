package com.example.securevote.model;

/**
 * Per-voter lifecycle. Transitions only move forward: INVITED -> AUTHENTICATED -> VOTED.
 */
public enum VoterState {
    INVITED,
    AUTHENTICATED,
    VOTED;

    public boolean canTransitionTo(VoterState next) {
        if (this == INVITED) {
            return next == AUTHENTICATED;
        }
        if (this == AUTHENTICATED) {
            return next == VOTED;
        }
        return false;
    }

    public boolean isTerminal() {
        return this == VOTED;
    }
}
