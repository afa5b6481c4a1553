package com.example.securevote.service;

import com.example.securevote.config.VoteProperties;
import com.example.securevote.model.IssuedBallotToken;
import com.example.securevote.model.RedeemedBallotToken;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.persistence.ballot.BallotTokenEntity;
import com.example.securevote.persistence.ballot.BallotTokenRepository;
import com.example.securevote.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Ballot-token half of the token vault. Works only on the ballot_box namespace and accepts
 * nothing but an election id when minting: a ballot token is freshly drawn randomness and is
 * not a function of anything about the voter.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BallotTokenVault {

    private final BallotTokenRepository tokenRepository;
    private final VoteProperties properties;
    private final Clock clock;

    /**
     * Mints a single-use ballot token for the election. Must run in the same transaction as the
     * has_voted flip that entitles it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IssuedBallotToken issueBallotToken(String electionId) {
        String token = CryptoUtil.newToken();
        long issuedAt = clock.millis();
        long expiresAt = issuedAt + properties.getBallotTokenTtl().toMillis();

        tokenRepository.save(new BallotTokenEntity(
            CryptoUtil.sha256Hex(token),
            electionId,
            issuedAt,
            expiresAt,
            false,
            null
        ));
        return new IssuedBallotToken(token, electionId, issuedAt, expiresAt);
    }

    /**
     * Consumes a ballot token. The flip is a conditional update, so among concurrent callers
     * exactly one succeeds; if the surrounding transaction rolls back the token is unused again.
     *
     * @return the redeemed token, or INVALID_TOKEN, ALREADY_USED, EXPIRED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Result<RedeemedBallotToken> redeemBallotToken(String ballotToken) {
        if (ballotToken == null || ballotToken.isBlank()) {
            return Result.failure(VoteError.INVALID_TOKEN);
        }
        String presentedHash = CryptoUtil.sha256Hex(ballotToken);
        Optional<BallotTokenEntity> found = tokenRepository.findById(presentedHash);
        if (found.isEmpty() || !CryptoUtil.constantTimeEquals(presentedHash, found.get().getTokenHash())) {
            return Result.failure(VoteError.INVALID_TOKEN);
        }

        BallotTokenEntity stored = found.get();
        long now = clock.millis();
        if (stored.isUsed()) {
            return Result.failure(VoteError.ALREADY_USED);
        }
        if (stored.isExpiredAt(now)) {
            return Result.failure(VoteError.EXPIRED);
        }
        if (tokenRepository.markUsed(presentedHash, now) != 1) {
            return Result.failure(VoteError.ALREADY_USED);
        }
        return Result.success(new RedeemedBallotToken(presentedHash, stored.getElectionId(), now));
    }
}
