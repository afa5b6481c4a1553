package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Returned once after a ballot is cast. The receipt lets the voter later confirm the ballot was
 * recorded; it reveals nothing about the choice.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BallotReceipt {
    private String receipt;
    private String electionId;
    private String ballotHash;
    private long castAt;
}
