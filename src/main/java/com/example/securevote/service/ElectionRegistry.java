package com.example.securevote.service;

import com.example.securevote.model.AuditEventType;
import com.example.securevote.model.ElectionStatus;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.persistence.election.ElectionEntity;
import com.example.securevote.persistence.election.ElectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Records the open/closed decision made by election management. The core does not decide when
 * an election closes; it only refuses issuance and casting unless the recorded flag is OPEN and
 * refuses tally reads unless it is CLOSED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElectionRegistry {

    static final String ACTOR = "election-registry";

    private static final Pattern ELECTION_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final ElectionRepository electionRepository;
    private final AuditLedger auditLedger;
    private final BallotBox ballotBox;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public static boolean isValidElectionId(String electionId) {
        return electionId != null && ELECTION_ID.matcher(electionId).matches();
    }

    // ==================== Lifecycle ====================

    /**
     * Marks the election open. Opening an already open election changes nothing; a closed
     * election is never reopened.
     */
    public Result<ElectionStatus> open(String electionId) {
        if (!isValidElectionId(electionId)) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "Invalid election id");
        }
        Result<ElectionStatus> result = unitOfWork.execute("open election", () -> {
            auditLedger.holdAppendOrder(electionId);
            Optional<ElectionEntity> existing = electionRepository.findById(electionId);
            if (existing.isPresent()) {
                if (existing.get().getStatus() == ElectionStatus.CLOSED) {
                    return Result.failure(VoteError.ELECTION_NOT_OPEN, "Election already closed");
                }
                return Result.success(ElectionStatus.OPEN);
            }
            auditLedger.append(electionId, AuditEventType.ELECTION_OPENED, ACTOR, Collections.emptyMap());
            electionRepository.save(new ElectionEntity(electionId, ElectionStatus.OPEN, clock.millis(), null));
            return Result.success(ElectionStatus.OPEN);
        });
        if (result.isSuccess()) {
            log.info("Election {} is open", electionId);
        }
        return result;
    }

    /**
     * Marks the election closed and records how many ballots it holds. No ballot can commit
     * after the ELECTION_CLOSED entry: casting checks the flag while holding the same append order.
     */
    public Result<ElectionStatus> close(String electionId) {
        if (!isValidElectionId(electionId)) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "Invalid election id");
        }
        Result<ElectionStatus> result = unitOfWork.execute("close election", () -> {
            auditLedger.holdAppendOrder(electionId);
            Optional<ElectionEntity> existing = electionRepository.findById(electionId);
            if (existing.isEmpty()) {
                return Result.failure(VoteError.UNKNOWN_ELECTION);
            }
            ElectionEntity election = existing.get();
            if (election.getStatus() == ElectionStatus.CLOSED) {
                return Result.failure(VoteError.ELECTION_NOT_OPEN, "Election already closed");
            }
            long ballotsCast = ballotBox.countBallots(electionId);
            auditLedger.append(electionId, AuditEventType.ELECTION_CLOSED, ACTOR,
                Map.of("ballotsCast", Long.toString(ballotsCast)));
            election.setStatus(ElectionStatus.CLOSED);
            election.setClosedAt(clock.millis());
            electionRepository.save(election);
            return Result.success(ElectionStatus.CLOSED);
        });
        if (result.isSuccess()) {
            log.info("Election {} is closed", electionId);
        }
        return result;
    }

    // ==================== Guards ====================

    /**
     * Must be called after the caller's first append for the election, so the flag is read under
     * the election's append order.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Result<ElectionStatus> requireOpen(String electionId) {
        Optional<ElectionEntity> election = electionRepository.findById(electionId);
        if (election.isEmpty() || election.get().getStatus() != ElectionStatus.OPEN) {
            return Result.failure(VoteError.ELECTION_NOT_OPEN);
        }
        return Result.success(ElectionStatus.OPEN);
    }

    @Transactional(readOnly = true)
    public Result<ElectionStatus> requireClosed(String electionId) {
        try {
            Optional<ElectionEntity> election = electionRepository.findById(electionId);
            if (election.isEmpty()) {
                return Result.failure(VoteError.UNKNOWN_ELECTION);
            }
            if (election.get().getStatus() != ElectionStatus.CLOSED) {
                return Result.failure(VoteError.ELECTION_NOT_CLOSED);
            }
            return Result.success(ElectionStatus.CLOSED);
        } catch (DataAccessException e) {
            log.error("Election registry unreadable: {}", e.getMessage());
            return Result.failure(VoteError.STORAGE_UNAVAILABLE);
        }
    }

    @Transactional
    public Optional<ElectionStatus> currentStatus(String electionId) {
        return electionRepository.findById(electionId).map(ElectionEntity::getStatus);
    }

    @Transactional(readOnly = true)
    public Optional<ElectionEntity> find(String electionId) {
        return electionRepository.findById(electionId);
    }
}
