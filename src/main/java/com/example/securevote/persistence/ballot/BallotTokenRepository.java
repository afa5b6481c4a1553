package com.example.securevote.persistence.ballot;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

@org.springframework.stereotype.Repository
public interface BallotTokenRepository extends Repository<BallotTokenEntity, String> {

    BallotTokenEntity save(BallotTokenEntity token);

    Optional<BallotTokenEntity> findById(String tokenHash);

    long countByElectionId(String electionId);

    /**
     * Single-use flip. Exactly one concurrent caller gets 1.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BallotTokenEntity t SET t.used = true, t.usedAt = :usedAt "
        + "WHERE t.tokenHash = :tokenHash AND t.used = false")
    int markUsed(@Param("tokenHash") String tokenHash, @Param("usedAt") long usedAt);
}
