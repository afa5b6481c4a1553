package com.example.securevote.persistence.audit;

import com.example.securevote.model.AuditEntry;
import com.example.securevote.persistence.AppendOnlyEntityListener;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * One link of an election's hash chain. Write-once: Hibernate treats it as immutable, the
 * entity listener rejects update/remove, and the database trigger rejects UPDATE/DELETE.
 */
@Entity
@Immutable
@EntityListeners(AppendOnlyEntityListener.class)
@Table(name = "audit_event", schema = "audit_ledger",
    uniqueConstraints = @UniqueConstraint(name = "uq_audit_election_seq", columnNames = {"election_id", "sequence_no"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuditEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false)
    private Long id;

    @Column(name = "election_id", nullable = false, updatable = false, length = 64)
    private String electionId;

    /**
     * Gap-free per election, starting at 1.
     */
    @Column(name = "sequence_no", nullable = false, updatable = false)
    private long sequenceNo;

    /**
     * Name of an {@link com.example.securevote.model.AuditEventType}, kept as the stored string so
     * a row with a forged type still loads and fails verification instead of failing the read.
     */
    @Column(name = "event_type", nullable = false, updatable = false, length = 32)
    private String eventType;

    /**
     * Name of the emitting component, never voter data.
     */
    @Column(name = "actor_ref", nullable = false, updatable = false, length = 64)
    private String actorRef;

    @Column(name = "payload", nullable = false, updatable = false, length = 4000)
    private String payload;

    @Column(name = "payload_hash", nullable = false, updatable = false, length = 64)
    private String payloadHash;

    @Column(name = "prev_hash", nullable = false, updatable = false, length = 64)
    private String prevHash;

    @Column(name = "entry_hash", nullable = false, updatable = false, length = 64)
    private String entryHash;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private long recordedAt;

    public AuditEntry toEntry() {
        return AuditEntry.builder()
            .electionId(electionId)
            .sequenceNo(sequenceNo)
            .eventType(eventType)
            .actorRef(actorRef)
            .payload(payload)
            .payloadHash(payloadHash)
            .prevHash(prevHash)
            .entryHash(entryHash)
            .recordedAt(recordedAt)
            .build();
    }
}
