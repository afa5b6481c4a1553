package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A freshly minted ballot token as handed to the voter. The raw token exists only here;
 * storage keeps its hash.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssuedBallotToken {
    private String token;
    private String electionId;
    private long issuedAt;
    private long expiresAt;

    @Override
    public String toString() {
        return "IssuedBallotToken(electionId=" + electionId + ", issuedAt=" + issuedAt
            + ", expiresAt=" + expiresAt + ")";
    }
}
