package com.example.securevote.service;

import com.example.securevote.model.ImportedVoter;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.model.VoterState;
import com.example.securevote.persistence.voter.VoterRecordEntity;
import com.example.securevote.persistence.voter.VoterRecordRepository;
import com.example.securevote.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Identity-token half of the token vault. Only ever sees the voter_registry namespace; it has
 * no handle on ballot tokens and nothing it returns can be joined to them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityTokenVault {

    private final VoterRecordRepository voterRepository;
    private final Clock clock;

    /**
     * Creates voter records with fresh identity tokens. Raw tokens are returned once and only
     * their hashes are stored.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<ImportedVoter> mintIdentityTokens(String electionId, int count, Duration ttl) {
        long now = clock.millis();
        long expiresAt = now + ttl.toMillis();

        List<VoterRecordEntity> records = new ArrayList<>(count);
        List<ImportedVoter> imported = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String identityToken = CryptoUtil.newToken();
            String voterId = UUID.randomUUID().toString();
            records.add(new VoterRecordEntity(
                voterId,
                electionId,
                CryptoUtil.sha256Hex(identityToken),
                VoterState.INVITED,
                false,
                now,
                expiresAt,
                null
            ));
            imported.add(new ImportedVoter(voterId, identityToken, expiresAt));
        }
        voterRepository.saveAll(records);
        return imported;
    }

    /**
     * Resolves an identity token to its voter record.
     *
     * Lookup is by SHA-256 of the presented token, so how far a guess matches the real token
     * has no bearing on which rows are touched; the final comparison is constant-time.
     *
     * @return the record, or INVALID_TOKEN, ALREADY_USED (the voter has voted), EXPIRED
     */
    @Transactional
    public Result<VoterRecordEntity> validateIdentity(String identityToken) {
        if (identityToken == null || identityToken.isBlank()) {
            return Result.failure(VoteError.INVALID_TOKEN);
        }
        String presentedHash = CryptoUtil.sha256Hex(identityToken);
        Optional<VoterRecordEntity> found = voterRepository.findByIdentityTokenHash(presentedHash);
        if (found.isEmpty() || !CryptoUtil.constantTimeEquals(presentedHash, found.get().getIdentityTokenHash())) {
            return Result.failure(VoteError.INVALID_TOKEN);
        }

        VoterRecordEntity record = found.get();
        if (record.isHasVoted()) {
            return Result.failure(VoteError.ALREADY_USED);
        }
        if (record.isExpiredAt(clock.millis())) {
            return Result.failure(VoteError.EXPIRED);
        }
        return Result.success(record);
    }

    @Transactional(readOnly = true)
    public long countVoters(String electionId) {
        return voterRepository.countByElectionId(electionId);
    }

    @Transactional(readOnly = true)
    public long countVoted(String electionId) {
        return voterRepository.countByElectionIdAndHasVotedTrue(electionId);
    }
}
