package com.example.securevote.persistence.election;

import com.example.securevote.model.ElectionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Open/closed flag per election, as decided by election management.
 */
@Entity
@Table(name = "election", schema = "election_registry")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ElectionEntity {

    @Id
    @Column(name = "election_id", nullable = false, length = 64)
    private String electionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ElectionStatus status;

    @Column(name = "opened_at", nullable = false)
    private long openedAt;

    @Column(name = "closed_at")
    private Long closedAt;
}
