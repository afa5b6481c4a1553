package com.example.securevote.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ElectionSummary {
    private String electionId;
    private ElectionStatus status;
    private long openedAt;
    private Long closedAt;
    private long voters;
    private long votersVoted;
    private long ballotsCast;
}
