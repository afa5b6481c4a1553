package com.example.securevote.service;

import com.example.securevote.model.ElectionSummary;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.persistence.election.ElectionEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turnout figures for election management. Reads aggregate counts from each namespace
 * separately; no query here spans two of them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElectionStatusService {

    private final ElectionRegistry electionRegistry;
    private final IdentityTokenVault identityTokenVault;
    private final BallotBox ballotBox;

    public Result<ElectionSummary> status(String electionId) {
        if (!ElectionRegistry.isValidElectionId(electionId)) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "Invalid election id");
        }
        try {
            Optional<ElectionEntity> found = electionRegistry.find(electionId);
            if (found.isEmpty()) {
                return Result.failure(VoteError.UNKNOWN_ELECTION);
            }
            ElectionEntity election = found.get();
            return Result.success(new ElectionSummary(
                electionId,
                election.getStatus(),
                election.getOpenedAt(),
                election.getClosedAt(),
                identityTokenVault.countVoters(electionId),
                identityTokenVault.countVoted(electionId),
                ballotBox.countBallots(electionId)
            ));
        } catch (DataAccessException e) {
            log.error("Election status unreadable for {}: {}", electionId, e.getMessage());
            return Result.failure(VoteError.STORAGE_UNAVAILABLE);
        }
    }
}
