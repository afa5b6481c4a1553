package com.example.securevote.persistence.audit;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

@org.springframework.stereotype.Repository
public interface AuditChainHeadRepository extends Repository<AuditChainHeadEntity, String> {

    AuditChainHeadEntity save(AuditChainHeadEntity head);

    Optional<AuditChainHeadEntity> findById(String electionId);

    /**
     * Row lock on the head; the cross-process half of the per-election append ordering.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM AuditChainHeadEntity h WHERE h.electionId = :electionId")
    Optional<AuditChainHeadEntity> findForUpdate(@Param("electionId") String electionId);
}
