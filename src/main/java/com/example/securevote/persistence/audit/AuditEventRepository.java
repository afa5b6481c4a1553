package com.example.securevote.persistence.audit;

import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append and read only. There is intentionally no save-all, update or delete.
 */
@org.springframework.stereotype.Repository
public interface AuditEventRepository extends Repository<AuditEventEntity, Long> {

    AuditEventEntity save(AuditEventEntity event);

    /**
     * Entries 1..lastSequenceNo of an election, in chain order.
     */
    List<AuditEventEntity> findByElectionIdAndSequenceNoLessThanEqualOrderBySequenceNoAsc(String electionId, long lastSequenceNo);

    List<AuditEventEntity> findByElectionIdOrderBySequenceNoAsc(String electionId);

    long countByElectionIdAndEventType(String electionId, String eventType);
}
