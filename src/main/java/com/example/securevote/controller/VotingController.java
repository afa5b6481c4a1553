package com.example.securevote.controller;

import com.example.securevote.model.BallotReceipt;
import com.example.securevote.model.IssuedBallotToken;
import com.example.securevote.model.ReceiptVerification;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoterState;
import com.example.securevote.service.BallotCipher;
import com.example.securevote.service.BallotStore;
import com.example.securevote.service.VoterStateMachine;
import com.example.securevote.util.TokenRedactor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Voter-facing endpoints. Voters authenticate with their identity or ballot token in the body;
 * tokens never appear in URLs or logs.
 */
@RestController
@RequestMapping("/api/voting")
@RequiredArgsConstructor
@Slf4j
public class VotingController {

    private final VoterStateMachine voterStateMachine;
    private final BallotStore ballotStore;
    private final BallotCipher ballotCipher;

    // ==================== Identity ====================

    /**
     * Authenticates the voter and issues a ballot token in one step.
     */
    @PostMapping("/identity-validate")
    public ResponseEntity<Map<String, Object>> validateIdentity(@RequestBody Map<String, String> request) {
        String identityToken = request.get("identityToken");
        if (identityToken == null || identityToken.isBlank()) {
            return ApiResponses.badRequest("identityToken is required");
        }
        log.debug("identity-validate token={}", TokenRedactor.redact(identityToken));

        Result<IssuedBallotToken> issued = voterStateMachine.authenticateAndIssue(identityToken);
        if (issued.isFailure()) {
            return ApiResponses.error(issued);
        }
        IssuedBallotToken token = issued.getValue();
        Map<String, Object> response = new HashMap<>();
        response.put("ballotToken", token.getToken());
        response.put("electionId", token.getElectionId());
        response.put("expiresAt", token.getExpiresAt());
        return ApiResponses.ok(response);
    }

    /**
     * Checks an identity token without issuing a ballot token.
     */
    @PostMapping("/identity-check")
    public ResponseEntity<Map<String, Object>> checkIdentity(@RequestBody Map<String, String> request) {
        String identityToken = request.get("identityToken");
        if (identityToken == null || identityToken.isBlank()) {
            return ApiResponses.badRequest("identityToken is required");
        }

        Result<VoterState> state = voterStateMachine.authenticate(identityToken);
        if (state.isFailure()) {
            return ApiResponses.error(state);
        }
        return ApiResponses.ok(Map.of("state", state.getValue().name()));
    }

    // ==================== Ballots ====================

    /**
     * Casts a ballot. Accepts {@code encryptedChoice} (base64, sealed by the client) or a plain
     * {@code choice}, which is sealed here before it reaches the ballot store.
     */
    @PostMapping("/ballot-cast")
    public ResponseEntity<Map<String, Object>> castBallot(@RequestBody Map<String, String> request) {
        String ballotToken = request.get("ballotToken");
        if (ballotToken == null || ballotToken.isBlank()) {
            return ApiResponses.badRequest("ballotToken is required");
        }
        log.debug("ballot-cast token={}", TokenRedactor.redact(ballotToken));

        byte[] sealed;
        String encryptedChoice = request.get("encryptedChoice");
        String choice = request.get("choice");
        if (encryptedChoice != null && !encryptedChoice.isBlank()) {
            try {
                sealed = Base64.getDecoder().decode(encryptedChoice.trim());
            } catch (IllegalArgumentException e) {
                return ApiResponses.badRequest("encryptedChoice must be base64");
            }
        } else if (choice != null && !choice.isBlank()) {
            sealed = ballotCipher.seal(choice.trim());
        } else {
            return ApiResponses.badRequest("choice or encryptedChoice is required");
        }

        Result<BallotReceipt> cast = ballotStore.cast(ballotToken, sealed);
        if (cast.isFailure()) {
            return ApiResponses.error(cast);
        }
        BallotReceipt receipt = cast.getValue();
        Map<String, Object> response = new HashMap<>();
        response.put("receipt", receipt.getReceipt());
        response.put("electionId", receipt.getElectionId());
        response.put("ballotHash", receipt.getBallotHash());
        response.put("castAt", receipt.getCastAt());
        return ApiResponses.ok(response);
    }

    @GetMapping("/receipts/{receipt}")
    public ResponseEntity<Map<String, Object>> verifyReceipt(@PathVariable String receipt) {
        Result<ReceiptVerification> verification = ballotStore.verifyReceipt(receipt);
        if (verification.isFailure()) {
            return ApiResponses.error(verification);
        }
        ReceiptVerification found = verification.getValue();
        Map<String, Object> response = new HashMap<>();
        response.put("verified", found.isVerified());
        if (found.isVerified()) {
            response.put("electionId", found.getElectionId());
            response.put("ballotHash", found.getBallotHash());
            response.put("castAt", found.getCastAt());
        }
        return ApiResponses.ok(response);
    }
}
