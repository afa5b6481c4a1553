package com.example.securevote.service;

import com.example.securevote.config.VoteProperties;
import com.example.securevote.model.AuditEventType;
import com.example.securevote.model.ElectionStatus;
import com.example.securevote.model.ImportedVoter;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates voter records for an election on behalf of voter management. The identity tokens come
 * back exactly once, for delivery to the voters; only their hashes are kept.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoterRegistrationService {

    static final String ACTOR = "voter-registration";
    static final int MAX_BATCH = 10_000;

    private final IdentityTokenVault identityTokenVault;
    private final ElectionRegistry electionRegistry;
    private final AuditLedger auditLedger;
    private final UnitOfWork unitOfWork;
    private final VoteProperties properties;

    /**
     * @param ttl identity token lifetime, or null for the configured default
     */
    public Result<List<ImportedVoter>> importVoters(String electionId, int count, Duration ttl) {
        if (!ElectionRegistry.isValidElectionId(electionId)) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "Invalid election id");
        }
        if (count < 1 || count > MAX_BATCH) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "count must be between 1 and " + MAX_BATCH);
        }
        Duration lifetime = ttl != null ? ttl : properties.getIdentityTokenTtl();
        if (lifetime.isNegative() || lifetime.isZero()) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "ttl must be positive");
        }

        Result<List<ImportedVoter>> result = unitOfWork.execute("import voters", () -> {
            auditLedger.holdAppendOrder(electionId);
            Optional<ElectionStatus> status = electionRegistry.currentStatus(electionId);
            if (status.isPresent() && status.get() == ElectionStatus.CLOSED) {
                return Result.failure(VoteError.ELECTION_NOT_OPEN, "Election already closed");
            }
            List<ImportedVoter> imported = identityTokenVault.mintIdentityTokens(electionId, count, lifetime);
            auditLedger.append(electionId, AuditEventType.VOTERS_IMPORTED, ACTOR,
                Map.of("count", Integer.toString(count)));
            return Result.success(imported);
        });
        if (result.isSuccess()) {
            log.info("Imported {} voters into election {}", count, electionId);
        }
        return result;
    }
}
