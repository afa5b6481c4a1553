package com.example.securevote.service;

import com.example.securevote.model.AuditEntry;
import com.example.securevote.model.AuditEventType;
import com.example.securevote.model.ChainVerification;
import com.example.securevote.util.CryptoUtil;

import java.util.List;

/**
 * Pure recomputation of an election's hash chain from genesis.
 * Reports the first sequence number at which stored content and chain disagree.
 */
public final class AuditChainVerifier {

    private AuditChainVerifier() {
    }

    /**
     * @param electionId     election the entries are expected to belong to
     * @param entries        entries in ascending sequence order
     * @param expectedLength sequence number recorded by the chain head; entries beyond it are ignored
     */
    public static ChainVerification verify(String electionId, List<AuditEntry> entries, long expectedLength) {
        String prev = CryptoUtil.ZERO_HASH;
        long expectedSeq = 1;

        for (AuditEntry entry : entries) {
            if (expectedSeq > expectedLength) {
                break;
            }
            if (entry.getSequenceNo() != expectedSeq || !electionId.equals(entry.getElectionId())
                || !AuditEventType.isKnown(entry.getEventType())) {
                return ChainVerification.broken(electionId, expectedSeq, expectedSeq - 1, prev);
            }
            if (!CryptoUtil.constantTimeEquals(prev, entry.getPrevHash())) {
                return ChainVerification.broken(electionId, expectedSeq, expectedSeq - 1, prev);
            }
            if (entry.getPayload() == null
                || !CryptoUtil.constantTimeEquals(AuditHasher.payloadHash(entry.getPayload()), entry.getPayloadHash())) {
                return ChainVerification.broken(electionId, expectedSeq, expectedSeq - 1, prev);
            }
            String recomputed = AuditHasher.entryHash(prev, entry);
            if (!CryptoUtil.constantTimeEquals(recomputed, entry.getEntryHash())) {
                return ChainVerification.broken(electionId, expectedSeq, expectedSeq - 1, prev);
            }
            prev = entry.getEntryHash();
            expectedSeq++;
        }

        // head says more entries exist than storage returned: the tail was removed
        if (expectedSeq <= expectedLength) {
            return ChainVerification.broken(electionId, expectedSeq, expectedSeq - 1, prev);
        }
        return ChainVerification.intact(electionId, expectedSeq - 1, prev);
    }

    /**
     * Verifies a full export with no separately recorded head.
     */
    public static ChainVerification verify(String electionId, List<AuditEntry> entries) {
        return verify(electionId, entries, entries.size());
    }
}
