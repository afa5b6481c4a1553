package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of recomputing an election's audit chain from genesis.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChainVerification {
    private String electionId;
    private boolean valid;

    /**
     * First sequence number whose content no longer matches the chain, or null when valid.
     */
    private Long brokenAt;

    private long entriesChecked;

    /**
     * Entry hash of the last verified entry (genesis seed for an empty chain).
     */
    private String headHash;

    public static ChainVerification intact(String electionId, long entriesChecked, String headHash) {
        return new ChainVerification(electionId, true, null, entriesChecked, headHash);
    }

    public static ChainVerification broken(String electionId, long brokenAt, long entriesChecked, String headHash) {
        return new ChainVerification(electionId, false, brokenAt, entriesChecked, headHash);
    }
}
