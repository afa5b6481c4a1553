package com.example.securevote.controller;

import com.example.securevote.model.ElectionStatus;
import com.example.securevote.model.ElectionSummary;
import com.example.securevote.model.EncryptedBallotView;
import com.example.securevote.model.ImportedVoter;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.service.BallotStore;
import com.example.securevote.service.ElectionRegistry;
import com.example.securevote.service.ElectionStatusService;
import com.example.securevote.service.VoterRegistrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Election management surface: records the open/closed decision, imports voters, reports status
 * and hands the sealed ballots of a closed election to the tally.
 */
@RestController
@RequestMapping("/api/elections")
@RequiredArgsConstructor
@Slf4j
public class ElectionController {

    private final ElectionRegistry electionRegistry;
    private final ElectionStatusService statusService;
    private final VoterRegistrationService registrationService;
    private final BallotStore ballotStore;

    // ==================== Lifecycle ====================

    @PostMapping("/{electionId}/open")
    public ResponseEntity<Map<String, Object>> open(@PathVariable String electionId) {
        Result<ElectionStatus> opened = electionRegistry.open(electionId);
        if (opened.isFailure()) {
            return ApiResponses.error(opened);
        }
        return ApiResponses.ok(Map.of("electionId", electionId, "status", opened.getValue().name()));
    }

    @PostMapping("/{electionId}/close")
    public ResponseEntity<Map<String, Object>> close(@PathVariable String electionId) {
        Result<ElectionStatus> closed = electionRegistry.close(electionId);
        if (closed.isFailure()) {
            return ApiResponses.error(closed);
        }
        return ApiResponses.ok(Map.of("electionId", electionId, "status", closed.getValue().name()));
    }

    @GetMapping("/{electionId}")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String electionId) {
        Result<ElectionSummary> summary = statusService.status(electionId);
        if (summary.isFailure()) {
            return ApiResponses.error(summary);
        }
        ElectionSummary election = summary.getValue();
        Map<String, Object> response = new HashMap<>();
        response.put("electionId", election.getElectionId());
        response.put("status", election.getStatus().name());
        response.put("openedAt", election.getOpenedAt());
        response.put("closedAt", election.getClosedAt());
        response.put("voters", election.getVoters());
        response.put("votersVoted", election.getVotersVoted());
        response.put("ballotsCast", election.getBallotsCast());
        return ApiResponses.ok(response);
    }

    // ==================== Voters ====================

    /**
     * Creates {@code count} voters. The identity tokens in the response are not retrievable again.
     */
    @PostMapping("/{electionId}/voters")
    public ResponseEntity<Map<String, Object>> importVoters(@PathVariable String electionId,
                                                            @RequestBody Map<String, Object> request) {
        if (request.get("count") == null) {
            return ApiResponses.badRequest("count is required");
        }
        Integer count = asInteger(request.get("count"));
        if (count == null) {
            return ApiResponses.badRequest("count must be a whole number");
        }
        Duration ttl = null;
        if (request.get("ttlHours") != null) {
            Integer hours = asInteger(request.get("ttlHours"));
            if (hours == null) {
                return ApiResponses.badRequest("ttlHours must be a number");
            }
            ttl = Duration.ofHours(hours);
        }

        Result<List<ImportedVoter>> imported = registrationService.importVoters(electionId, count, ttl);
        if (imported.isFailure()) {
            return ApiResponses.error(imported);
        }
        List<Map<String, Object>> voters = imported.getValue().stream()
            .map(voter -> Map.<String, Object>of(
                "voterId", voter.getVoterId(),
                "identityToken", voter.getIdentityToken(),
                "expiresAt", voter.getExpiresAt()))
            .collect(Collectors.toList());
        return ApiResponses.ok(Map.of("electionId", electionId, "count", voters.size(), "voters", voters));
    }

    // ==================== Tally ====================

    /**
     * Sealed ballots of a closed election, in ballot-id order. Decryption and counting happen
     * outside this service.
     */
    @GetMapping("/{electionId}/tally")
    public ResponseEntity<Map<String, Object>> tally(@PathVariable String electionId) {
        Result<Iterable<EncryptedBallotView>> read = ballotStore.readForTally(electionId);
        if (read.isFailure()) {
            return ApiResponses.error(read);
        }
        List<Map<String, Object>> ballots = new ArrayList<>();
        try {
            // pages are fetched while iterating
            for (EncryptedBallotView ballot : read.getValue()) {
                ballots.add(Map.of(
                    "ballotId", ballot.getBallotId(),
                    "encryptedChoice", Base64.getEncoder().encodeToString(ballot.getEncryptedChoice()),
                    "castAt", ballot.getCastAt()));
            }
        } catch (DataAccessException e) {
            log.error("Tally read for election {} failed after {} ballots: {}", electionId, ballots.size(), e.getMessage());
            return ApiResponses.error(VoteError.STORAGE_UNAVAILABLE, null);
        }
        log.info("Tally read for election {}: {} ballots", electionId, ballots.size());
        return ApiResponses.ok(Map.of("electionId", electionId, "count", ballots.size(), "ballots", ballots));
    }

    /**
     * Whole numbers in int range only; fractions and out-of-range values give null.
     */
    private static Integer asInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                return null;
            }
            return (int) number;
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
