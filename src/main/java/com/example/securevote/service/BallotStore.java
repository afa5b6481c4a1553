package com.example.securevote.service;

import com.example.securevote.config.VoteProperties;
import com.example.securevote.model.AuditEventType;
import com.example.securevote.model.BallotReceipt;
import com.example.securevote.model.EncryptedBallotView;
import com.example.securevote.model.ReceiptVerification;
import com.example.securevote.model.RedeemedBallotToken;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.util.CryptoUtil;
import com.example.securevote.util.StripedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Encrypted ballots keyed by nothing but a random id and the hash of the ballot token that
 * paid for them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BallotStore {

    static final String ACTOR = "ballot-store";
    static final int MAX_BALLOT_BYTES = 8192;

    private final BallotTokenVault ballotTokenVault;
    private final BallotBox ballotBox;
    private final ElectionRegistry electionRegistry;
    private final AuditLedger auditLedger;
    private final UnitOfWork unitOfWork;
    private final StripedLocks tokenLocks;
    private final VoteProperties properties;

    // ==================== Cast ====================

    /**
     * Redeems the ballot token and stores the ballot in one transaction. If storing fails the
     * redemption rolls back with it, so the same token can be retried until exactly one ballot
     * exists for it.
     *
     * @return the receipt, or INVALID_TOKEN, ALREADY_USED, EXPIRED, ELECTION_NOT_OPEN,
     *         MALFORMED_REQUEST, STORAGE_UNAVAILABLE (safe to retry)
     */
    public Result<BallotReceipt> cast(String ballotToken, byte[] encryptedChoice) {
        if (ballotToken == null || ballotToken.isBlank()) {
            return Result.failure(VoteError.INVALID_TOKEN);
        }
        if (encryptedChoice == null || encryptedChoice.length == 0 || encryptedChoice.length > MAX_BALLOT_BYTES) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "Encrypted choice must be 1.." + MAX_BALLOT_BYTES + " bytes");
        }

        ReentrantLock lock = tokenLocks.lockFor(CryptoUtil.sha256Hex(ballotToken));
        lock.lock();
        try {
            Result<BallotReceipt> result = unitOfWork.execute("cast ballot",
                () -> ballotTokenVault.redeemBallotToken(ballotToken)
                    .flatMap(redeemed -> store(redeemed, encryptedChoice)));
            if (result.isFailure()) {
                log.warn("Ballot rejected: {}", result.getError().get());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private Result<BallotReceipt> store(RedeemedBallotToken redeemed, byte[] encryptedChoice) {
        String electionId = redeemed.getElectionId();
        BallotReceipt receipt = ballotBox.deposit(electionId, redeemed.getTokenHash(), encryptedChoice,
            redeemed.getRedeemedAt());
        auditLedger.append(electionId, AuditEventType.BALLOT_CAST, ACTOR,
            Map.of("ballotHash", receipt.getBallotHash()));

        Result<?> open = electionRegistry.requireOpen(electionId);
        if (open.isFailure()) {
            return open.castFailure();
        }
        return Result.success(receipt);
    }

    // ==================== Tally ====================

    /**
     * Every ballot of a closed election, read lazily page by page. Each call to
     * {@code iterator()} starts a fresh scan, so an interrupted tally simply starts over.
     *
     * @return the ballots, or UNKNOWN_ELECTION, ELECTION_NOT_CLOSED, STORAGE_UNAVAILABLE
     */
    public Result<Iterable<EncryptedBallotView>> readForTally(String electionId) {
        Result<?> closed = electionRegistry.requireClosed(electionId);
        if (closed.isFailure()) {
            return closed.castFailure();
        }
        int pageSize = Math.max(1, properties.getTallyPageSize());
        Iterable<EncryptedBallotView> ballots = () -> new KeysetIterator(electionId, pageSize);
        return Result.success(ballots);
    }

    private final class KeysetIterator implements Iterator<EncryptedBallotView> {
        private final String electionId;
        private final int pageSize;
        private List<EncryptedBallotView> page = List.of();
        private int position;
        private String lastBallotId = "";
        private boolean exhausted;

        KeysetIterator(String electionId, int pageSize) {
            this.electionId = electionId;
            this.pageSize = pageSize;
        }

        @Override
        public boolean hasNext() {
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            page = ballotBox.page(electionId, lastBallotId, pageSize);
            position = 0;
            if (page.size() < pageSize) {
                exhausted = true;
            }
            if (!page.isEmpty()) {
                lastBallotId = page.get(page.size() - 1).getBallotId();
            }
            return !page.isEmpty();
        }

        @Override
        public EncryptedBallotView next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.get(position++);
        }
    }

    // ==================== Receipts ====================

    /**
     * Confirms that a ballot with this receipt was recorded, without revealing its content.
     */
    public Result<ReceiptVerification> verifyReceipt(String receipt) {
        if (receipt == null || receipt.isBlank()) {
            return Result.failure(VoteError.MALFORMED_REQUEST, "Receipt is required");
        }
        try {
            return Result.success(ballotBox.lookupReceipt(receipt));
        } catch (DataAccessException e) {
            log.error("Receipt lookup failed: {}", e.getMessage());
            return Result.failure(VoteError.STORAGE_UNAVAILABLE);
        }
    }
}
