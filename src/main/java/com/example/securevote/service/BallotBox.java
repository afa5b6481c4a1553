package com.example.securevote.service;

import com.example.securevote.model.BallotReceipt;
import com.example.securevote.model.EncryptedBallotView;
import com.example.securevote.model.ReceiptVerification;
import com.example.securevote.persistence.ballot.EncryptedBallotEntity;
import com.example.securevote.persistence.ballot.EncryptedBallotRepository;
import com.example.securevote.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sole owner of the encrypted ballot table. Inserts and reads only.
 */
@Component
@RequiredArgsConstructor
public class BallotBox {

    private final EncryptedBallotRepository ballotRepository;

    /**
     * Stores a ballot against a redeemed token hash. Runs inside the redemption's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BallotReceipt deposit(String electionId, String ballotTokenHash, byte[] encryptedChoice, long castAt) {
        String receipt = CryptoUtil.newToken();
        String ballotHash = CryptoUtil.sha256Hex(encryptedChoice);

        ballotRepository.save(new EncryptedBallotEntity(
            UUID.randomUUID().toString(),
            ballotTokenHash,
            electionId,
            encryptedChoice.clone(),
            ballotHash,
            CryptoUtil.sha256Hex(receipt),
            castAt
        ));
        return new BallotReceipt(receipt, electionId, ballotHash, castAt);
    }

    @Transactional(readOnly = true)
    public ReceiptVerification lookupReceipt(String receipt) {
        String receiptHash = CryptoUtil.sha256Hex(receipt);
        return ballotRepository.findByReceiptHash(receiptHash)
            .filter(ballot -> CryptoUtil.constantTimeEquals(receiptHash, ballot.getReceiptHash()))
            .map(ballot -> new ReceiptVerification(true, ballot.getElectionId(), ballot.getBallotHash(), ballot.getCastAt()))
            .orElseGet(ReceiptVerification::notFound);
    }

    /**
     * One keyset page of the election's ballots, ordered by ballot id, strictly after {@code afterBallotId}.
     */
    @Transactional(readOnly = true)
    public List<EncryptedBallotView> page(String electionId, String afterBallotId, int pageSize) {
        return ballotRepository
            .findByElectionIdAndBallotIdGreaterThanOrderByBallotIdAsc(electionId, afterBallotId, PageRequest.of(0, pageSize))
            .stream()
            .map(ballot -> new EncryptedBallotView(
                ballot.getBallotId(), ballot.getElectionId(), ballot.getEncryptedChoice(), ballot.getCastAt()))
            .collect(Collectors.toList());
    }

    @Transactional
    public long countBallots(String electionId) {
        return ballotRepository.countByElectionId(electionId);
    }
}
