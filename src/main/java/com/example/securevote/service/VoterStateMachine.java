package com.example.securevote.service;

import com.example.securevote.model.AuditEventType;
import com.example.securevote.model.IssuedBallotToken;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.model.VoterState;
import com.example.securevote.persistence.voter.VoterRecordEntity;
import com.example.securevote.persistence.voter.VoterRecordRepository;
import com.example.securevote.util.CryptoUtil;
import com.example.securevote.util.StripedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-voter lifecycle: INVITED, then AUTHENTICATED, then VOTED, never backwards.
 *
 * The AUTHENTICATED to VOTED step, the has_voted flip, the ballot token mint and its audit entry
 * commit as one transaction. Requests carrying the same identity token are serialized on a lock
 * stripe in this process and on a conditional update in the database, so exactly one wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoterStateMachine {

    static final String ACTOR = "voter-state-machine";

    private final IdentityTokenVault identityTokenVault;
    private final BallotTokenVault ballotTokenVault;
    private final VoterRecordRepository voterRepository;
    private final ElectionRegistry electionRegistry;
    private final AuditLedger auditLedger;
    private final UnitOfWork unitOfWork;
    private final StripedLocks tokenLocks;

    // ==================== Invited -> Authenticated ====================

    /**
     * Validates the identity token and moves the voter to AUTHENTICATED without issuing anything.
     * Repeating it for an authenticated voter is harmless.
     */
    public Result<VoterState> authenticate(String identityToken) {
        if (identityToken == null || identityToken.isBlank()) {
            return Result.failure(VoteError.INVALID_TOKEN);
        }
        ReentrantLock lock = tokenLocks.lockFor(CryptoUtil.sha256Hex(identityToken));
        lock.lock();
        try {
            return unitOfWork.execute("authenticate voter",
                () -> validateAndAuthenticate(identityToken).flatMap(voter -> electionRegistry
                    .requireOpen(voter.getElectionId())
                    .map(open -> voter.getState())));
        } finally {
            lock.unlock();
        }
    }

    // ==================== Authenticated -> Voted ====================

    /**
     * Authenticates the voter and hands out a ballot token in one step. Callers see either a
     * ballot token or an error, never an intermediate state: on any failure the voter record,
     * the token tables and the ledger are exactly as before the call.
     *
     * @return the ballot token, or INVALID_TOKEN, EXPIRED, ALREADY_VOTED, ELECTION_NOT_OPEN,
     *         STORAGE_UNAVAILABLE (safe to retry)
     */
    public Result<IssuedBallotToken> authenticateAndIssue(String identityToken) {
        if (identityToken == null || identityToken.isBlank()) {
            return Result.failure(VoteError.INVALID_TOKEN);
        }
        ReentrantLock lock = tokenLocks.lockFor(CryptoUtil.sha256Hex(identityToken));
        lock.lock();
        try {
            Result<IssuedBallotToken> result = unitOfWork.execute("issue ballot token",
                () -> validateAndAuthenticate(identityToken).flatMap(this::issue));
            if (result.isFailure()) {
                log.warn("Ballot token issuance rejected: {}", result.getError().get());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private Result<IssuedBallotToken> issue(VoterRecordEntity voter) {
        String electionId = voter.getElectionId();
        Result<?> open = electionRegistry.requireOpen(electionId);
        if (open.isFailure()) {
            return open.castFailure();
        }
        int flipped = voterRepository.markVoted(voter.getVoterId(), VoterState.AUTHENTICATED, VoterState.VOTED);
        if (flipped != 1) {
            return Result.failure(VoteError.ALREADY_VOTED);
        }

        // only the election id is carried past this point
        IssuedBallotToken token = ballotTokenVault.issueBallotToken(electionId);
        auditLedger.append(electionId, AuditEventType.BALLOT_TOKEN_ISSUED, ACTOR, Collections.emptyMap());
        return Result.success(token);
    }

    private Result<VoterRecordEntity> validateAndAuthenticate(String identityToken) {
        Result<VoterRecordEntity> validated = identityTokenVault.validateIdentity(identityToken);
        if (validated.isFailure()) {
            if (validated.getError().get() == VoteError.ALREADY_USED) {
                return Result.failure(VoteError.ALREADY_VOTED);
            }
            return validated;
        }

        VoterRecordEntity voter = validated.getValue();
        if (voter.getState() == VoterState.INVITED) {
            int moved = voterRepository.transition(voter.getVoterId(), VoterState.INVITED, VoterState.AUTHENTICATED);
            if (moved != 1) {
                return Result.failure(VoteError.ALREADY_VOTED);
            }
            voter.setState(VoterState.AUTHENTICATED);
            auditLedger.append(voter.getElectionId(), AuditEventType.VOTER_AUTHENTICATED, ACTOR, Collections.emptyMap());
        } else if (!voter.getState().canTransitionTo(VoterState.VOTED)) {
            return Result.failure(VoteError.ALREADY_VOTED);
        } else {
            // the open check that follows must still run under the election's append order
            auditLedger.holdAppendOrder(voter.getElectionId());
        }
        return Result.success(voter);
    }
}
