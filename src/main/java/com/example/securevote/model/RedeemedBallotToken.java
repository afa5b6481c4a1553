package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Result of a successful single-use redemption: the election the token belongs to
 * and the hash under which the token is stored.
 */
@Data
@AllArgsConstructor
public class RedeemedBallotToken {
    private String tokenHash;
    private String electionId;
    private long redeemedAt;
}
