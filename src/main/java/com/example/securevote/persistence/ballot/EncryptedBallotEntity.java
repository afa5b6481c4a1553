package com.example.securevote.persistence.ballot;

import com.example.securevote.persistence.AppendOnlyEntityListener;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * A cast ballot. Keyed by a random id and referencing only the ballot token hash; the table has
 * no voter column, index or foreign key.
 */
@Entity
@Immutable
@EntityListeners(AppendOnlyEntityListener.class)
@Table(name = "encrypted_ballot", schema = "ballot_box", indexes = {
    @Index(name = "idx_ballot_election", columnList = "election_id,ballot_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedBallotEntity {

    /**
     * Random UUID, so storage order carries no information about cast order.
     */
    @Id
    @Column(name = "ballot_id", nullable = false, updatable = false, length = 36)
    private String ballotId;

    @Column(name = "ballot_token_hash", nullable = false, updatable = false, unique = true, length = 64)
    private String ballotTokenHash;

    @Column(name = "election_id", nullable = false, updatable = false, length = 64)
    private String electionId;

    @Column(name = "encrypted_choice", nullable = false, updatable = false, length = 8192)
    private byte[] encryptedChoice;

    /**
     * SHA-256 of the encrypted choice, shown on receipts and in the BALLOT_CAST audit payload.
     */
    @Column(name = "ballot_hash", nullable = false, updatable = false, length = 64)
    private String ballotHash;

    @Column(name = "receipt_hash", nullable = false, updatable = false, unique = true, length = 64)
    private String receiptHash;

    @Column(name = "cast_at", nullable = false, updatable = false)
    private long castAt;
}
