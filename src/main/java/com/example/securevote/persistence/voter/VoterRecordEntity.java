package com.example.securevote.persistence.voter;

import com.example.securevote.model.VoterState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A voter's right to participate in one election. Lives in the voter_registry schema, which has
 * no table, column or key in common with the ballot_box schema other than the election id.
 */
@Entity
@Table(name = "voter_record", schema = "voter_registry", indexes = {
    @Index(name = "idx_voter_election", columnList = "election_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoterRecordEntity {

    @Id
    @Column(name = "voter_id", nullable = false, length = 36)
    private String voterId;

    @Column(name = "election_id", nullable = false, length = 64)
    private String electionId;

    /**
     * SHA-256 of the identity token. The raw token is never persisted.
     */
    @Column(name = "identity_token_hash", nullable = false, unique = true, length = 64)
    private String identityTokenHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private VoterState state;

    /**
     * Monotonic: flips to true once per election and is never reset.
     */
    @Column(name = "has_voted", nullable = false)
    private boolean hasVoted;

    @Column(name = "issued_at", nullable = false)
    private long issuedAt;

    @Column(name = "expires_at", nullable = false)
    private long expiresAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean isExpiredAt(long nowMillis) {
        return nowMillis > expiresAt;
    }
}
