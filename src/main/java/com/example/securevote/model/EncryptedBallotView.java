package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tally-side view of a stored ballot: the sealed choice and nothing that identifies a token or voter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedBallotView {
    private String ballotId;
    private String electionId;
    private byte[] encryptedChoice;
    private long castAt;
}
