package com.example.securevote.service;

import com.example.securevote.model.AuditEntry;
import com.example.securevote.model.AuditEventType;
import com.example.securevote.model.ChainVerification;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.persistence.audit.AuditChainHeadEntity;
import com.example.securevote.persistence.audit.AuditChainHeadRepository;
import com.example.securevote.persistence.audit.AuditEventEntity;
import com.example.securevote.persistence.audit.AuditEventRepository;
import com.example.securevote.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Append-only, hash-chained record of every security-relevant event, one chain per election.
 *
 * Appends for one election are totally ordered: an in-process lock per election is taken on
 * append and held until the enclosing transaction completes, and the chain head row is read
 * with a pessimistic lock so other processes serialize on the database. Different elections
 * never contend. Readers never take either lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLedger {

    private final AuditEventRepository eventRepository;
    private final AuditChainHeadRepository headRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, ReentrantLock> appendLocks = new ConcurrentHashMap<>();

    // ==================== Append ====================

    /**
     * Appends one event to the election's chain inside the caller's transaction, so the event
     * commits or rolls back together with the state change it records.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException when called outside a transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry append(String electionId, AuditEventType eventType, String actorRef, Map<String, String> payload) {
        holdAppendOrder(electionId);

        AuditChainHeadEntity head = headRepository.findForUpdate(electionId)
            .orElseGet(() -> new AuditChainHeadEntity(electionId, 0L, CryptoUtil.ZERO_HASH, 0L, null));

        long sequenceNo = head.getLastSequenceNo() + 1;
        long recordedAt = clock.millis();
        String canonicalPayload = AuditHasher.canonicalPayload(payload);
        String canonicalEntry = AuditHasher.canonicalEntry(electionId, eventType.name(), actorRef, recordedAt, canonicalPayload);
        String entryHash = AuditHasher.entryHash(head.getLastEntryHash(), canonicalEntry, sequenceNo);

        AuditEventEntity event = new AuditEventEntity(
            null,
            electionId,
            sequenceNo,
            eventType.name(),
            actorRef,
            canonicalPayload,
            AuditHasher.payloadHash(canonicalPayload),
            head.getLastEntryHash(),
            entryHash,
            recordedAt
        );
        eventRepository.save(event);

        head.setLastSequenceNo(sequenceNo);
        head.setLastEntryHash(entryHash);
        head.setUpdatedAt(recordedAt);
        headRepository.save(head);

        log.debug("Appended audit event {}#{} type={}", electionId, sequenceNo, eventType);
        return event.toEntry();
    }

    /**
     * Takes the election's append ordering for the rest of the caller's transaction. Work done
     * after this call is ordered against every other append to the same election, which lets
     * callers read state (ballot counts, the open flag) that must agree with the entry they append.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void holdAppendOrder(String electionId) {
        ReentrantLock lock = appendLocks.computeIfAbsent(electionId, id -> new ReentrantLock());
        lock.lock();
        try {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    lock.unlock();
                }
            });
        } catch (RuntimeException e) {
            lock.unlock();
            throw e;
        }
    }

    // ==================== Verification ====================

    /**
     * Recomputes every entry hash of the election from genesis.
     *
     * @return the verification on an intact chain; CHAIN_BROKEN (with the first bad sequence
     *         number in the message) otherwise
     */
    @Transactional(readOnly = true)
    public Result<ChainVerification> verifyChain(String electionId) {
        Result<ChainVerification> inspected = inspectChain(electionId);
        if (inspected.isFailure() || inspected.getValue().isValid()) {
            return inspected;
        }
        return Result.failure(VoteError.CHAIN_BROKEN,
            "Audit chain broken at sequence " + inspected.getValue().getBrokenAt());
    }

    /**
     * Same recomputation as {@link #verifyChain(String)}, returning the detail for a broken chain
     * as a value: break position, number of entries that verified, hash of the verified prefix.
     * The chain head is read first and exactly that prefix is verified, so concurrent appends
     * never produce a false break.
     */
    @Transactional(readOnly = true)
    public Result<ChainVerification> inspectChain(String electionId) {
        try {
            Optional<AuditChainHeadEntity> head = headRepository.findById(electionId);
            long expectedLength = head.map(AuditChainHeadEntity::getLastSequenceNo).orElse(0L);

            List<AuditEntry> entries = eventRepository
                .findByElectionIdAndSequenceNoLessThanEqualOrderBySequenceNoAsc(electionId, expectedLength)
                .stream()
                .map(AuditEventEntity::toEntry)
                .collect(Collectors.toList());

            ChainVerification verification = AuditChainVerifier.verify(electionId, entries, expectedLength);
            if (verification.isValid() && head.isPresent()
                && !CryptoUtil.constantTimeEquals(verification.getHeadHash(), head.get().getLastEntryHash())) {
                // every entry links up but the head records a different last hash
                verification = ChainVerification.broken(electionId, expectedLength,
                    expectedLength - 1, verification.getHeadHash());
            }

            if (!verification.isValid()) {
                eventPublisher.publishEvent(new ChainBrokenEvent(electionId, verification.getBrokenAt()));
            } else {
                log.debug("Verified audit chain for {}: {} entries", electionId, verification.getEntriesChecked());
            }
            return Result.success(verification);
        } catch (DataAccessException e) {
            log.error("Audit chain for {} could not be read: {}", electionId, e.getMessage(), e);
            return Result.failure(VoteError.STORAGE_UNAVAILABLE);
        }
    }

    // ==================== Reads ====================

    @Transactional(readOnly = true)
    public List<AuditEntry> entries(String electionId) {
        return eventRepository.findByElectionIdOrderBySequenceNoAsc(electionId)
            .stream()
            .map(AuditEventEntity::toEntry)
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long countEvents(String electionId, AuditEventType eventType) {
        return eventRepository.countByElectionIdAndEventType(electionId, eventType.name());
    }
}
