package com.example.securevote.persistence.audit;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Transactional counter for one election's chain: the last sequence number and its entry hash.
 * Updated in the same transaction as the entry it points at.
 */
@Entity
@Table(name = "audit_chain_head", schema = "audit_ledger")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuditChainHeadEntity {

    @Id
    @Column(name = "election_id", nullable = false, length = 64)
    private String electionId;

    @Column(name = "last_sequence_no", nullable = false)
    private long lastSequenceNo;

    @Column(name = "last_entry_hash", nullable = false, length = 64)
    private String lastEntryHash;

    @Column(name = "updated_at", nullable = false)
    private long updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
