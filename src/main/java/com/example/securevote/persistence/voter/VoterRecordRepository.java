package com.example.securevote.persistence.voter;

import com.example.securevote.model.VoterState;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Voter records. Deliberately not a JpaRepository: there is no delete, and state only moves
 * forward through the conditional updates below.
 */
@org.springframework.stereotype.Repository
public interface VoterRecordRepository extends Repository<VoterRecordEntity, String> {

    <S extends VoterRecordEntity> List<S> saveAll(Iterable<S> records);

    Optional<VoterRecordEntity> findByIdentityTokenHash(String identityTokenHash);

    long countByElectionId(String electionId);

    long countByElectionIdAndHasVotedTrue(String electionId);

    /**
     * Compare-and-set on the lifecycle state. Returns 1 when this caller won the transition.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VoterRecordEntity v SET v.state = :next, v.version = v.version + 1 "
        + "WHERE v.voterId = :voterId AND v.state = :expected AND v.hasVoted = false")
    int transition(@Param("voterId") String voterId,
                   @Param("expected") VoterState expected,
                   @Param("next") VoterState next);

    /**
     * Flips has_voted from false to true together with the VOTED state. Returns 0 when another
     * request already flipped it.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VoterRecordEntity v SET v.hasVoted = true, v.state = :voted, v.version = v.version + 1 "
        + "WHERE v.voterId = :voterId AND v.state = :authenticated AND v.hasVoted = false")
    int markVoted(@Param("voterId") String voterId,
                  @Param("authenticated") VoterState authenticated,
                  @Param("voted") VoterState voted);
}
