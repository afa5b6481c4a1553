package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Detached copy of one audit ledger entry, as exported to auditors and fed to the chain verifier.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {
    private String electionId;
    private long sequenceNo;
    /**
     * Event type exactly as stored. Normally an {@link AuditEventType} name.
     */
    private String eventType;
    private String actorRef;

    /**
     * Canonical JSON of the event payload (sorted keys).
     */
    private String payload;

    private String payloadHash;
    private String prevHash;
    private String entryHash;

    /**
     * Epoch milliseconds.
     */
    private long recordedAt;
}
