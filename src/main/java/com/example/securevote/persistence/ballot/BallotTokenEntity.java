package com.example.securevote.persistence.ballot;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A right to cast exactly one ballot. Carries no voter reference of any kind: the only
 * association is the election id.
 */
@Entity
@Table(name = "ballot_token", schema = "ballot_box", indexes = {
    @Index(name = "idx_ballot_token_election", columnList = "election_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BallotTokenEntity {

    /**
     * SHA-256 of the ballot token, which is 256 bits of fresh randomness.
     */
    @Id
    @Column(name = "token_hash", nullable = false, length = 64)
    private String tokenHash;

    @Column(name = "election_id", nullable = false, length = 64)
    private String electionId;

    @Column(name = "issued_at", nullable = false)
    private long issuedAt;

    @Column(name = "expires_at", nullable = false)
    private long expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private Long usedAt;

    public boolean isExpiredAt(long nowMillis) {
        return nowMillis > expiresAt;
    }
}
