package com.example.securevote.persistence.ballot;

import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Append-only ballot storage: insert and read, nothing else.
 */
@org.springframework.stereotype.Repository
public interface EncryptedBallotRepository extends Repository<EncryptedBallotEntity, String> {

    EncryptedBallotEntity save(EncryptedBallotEntity ballot);

    Optional<EncryptedBallotEntity> findByReceiptHash(String receiptHash);

    long countByElectionId(String electionId);

    /**
     * Keyset page for tally reads: ballots of one election with id after the given one.
     */
    List<EncryptedBallotEntity> findByElectionIdAndBallotIdGreaterThanOrderByBallotIdAsc(
        String electionId, String afterBallotId, Pageable page);
}
