package com.example.securevote.controller;

import com.example.securevote.model.BallotReceipt;
import com.example.securevote.model.IssuedBallotToken;
import com.example.securevote.model.ReceiptVerification;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.model.VoterState;
import com.example.securevote.service.BallotCipher;
import com.example.securevote.service.BallotStore;
import com.example.securevote.service.VoterStateMachine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VotingController.
 */
@ExtendWith(MockitoExtension.class)
class VotingControllerTest {

    @Mock
    private VoterStateMachine voterStateMachine;

    @Mock
    private BallotStore ballotStore;

    @Mock
    private BallotCipher ballotCipher;

    @InjectMocks
    private VotingController votingController;

    @Test
    void testIdentityValidateIssuesBallotToken() {
        when(voterStateMachine.authenticateAndIssue("id-token"))
            .thenReturn(Result.success(new IssuedBallotToken("ballot-token", "e1", 1L, 2L)));

        ResponseEntity<Map<String, Object>> response =
            votingController.validateIdentity(Map.of("identityToken", "id-token"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(true, response.getBody().get("success"));
        assertEquals("ballot-token", response.getBody().get("ballotToken"));
        assertEquals("e1", response.getBody().get("electionId"));
    }

    @Test
    void testIdentityValidateMapsErrors() {
        when(voterStateMachine.authenticateAndIssue("voted"))
            .thenReturn(Result.failure(VoteError.ALREADY_VOTED));
        when(voterStateMachine.authenticateAndIssue("down"))
            .thenReturn(Result.failure(VoteError.STORAGE_UNAVAILABLE));

        ResponseEntity<Map<String, Object>> voted = votingController.validateIdentity(Map.of("identityToken", "voted"));
        ResponseEntity<Map<String, Object>> down = votingController.validateIdentity(Map.of("identityToken", "down"));

        assertEquals(HttpStatus.CONFLICT, voted.getStatusCode());
        assertEquals("ALREADY_VOTED", voted.getBody().get("error"));
        assertEquals(false, voted.getBody().get("success"));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, down.getStatusCode());
        assertEquals(true, down.getBody().get("retryable"));
    }

    @Test
    void testIdentityValidateRequiresToken() {
        ResponseEntity<Map<String, Object>> response = votingController.validateIdentity(Map.of());

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verifyNoInteractions(voterStateMachine);
    }

    @Test
    void testIdentityCheck() {
        when(voterStateMachine.authenticate("id-token")).thenReturn(Result.success(VoterState.AUTHENTICATED));

        ResponseEntity<Map<String, Object>> response =
            votingController.checkIdentity(Map.of("identityToken", "id-token"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("AUTHENTICATED", response.getBody().get("state"));
    }

    @Test
    void testCastSealsPlainChoice() {
        byte[] sealed = {9, 9, 9};
        when(ballotCipher.seal("A")).thenReturn(sealed);
        when(ballotStore.cast("ballot-token", sealed))
            .thenReturn(Result.success(new BallotReceipt("receipt", "e1", "hash", 5L)));

        ResponseEntity<Map<String, Object>> response =
            votingController.castBallot(Map.of("ballotToken", "ballot-token", "choice", "A"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("receipt", response.getBody().get("receipt"));
        assertEquals("hash", response.getBody().get("ballotHash"));
    }

    @Test
    void testCastPassesClientSealedChoiceThrough() {
        byte[] clientSealed = {1, 2, 3, 4};
        when(ballotStore.cast(eq("ballot-token"), any(byte[].class)))
            .thenReturn(Result.failure(VoteError.ALREADY_USED));

        ResponseEntity<Map<String, Object>> response = votingController.castBallot(Map.of(
            "ballotToken", "ballot-token",
            "encryptedChoice", Base64.getEncoder().encodeToString(clientSealed)));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("ALREADY_USED", response.getBody().get("error"));
        verify(ballotStore).cast("ballot-token", clientSealed);
        verifyNoInteractions(ballotCipher);
    }

    @Test
    void testCastRejectsMalformedInput() {
        assertEquals(HttpStatus.BAD_REQUEST,
            votingController.castBallot(Map.of("ballotToken", "t")).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
            votingController.castBallot(Map.of("ballotToken", "t", "encryptedChoice", "***")).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
            votingController.castBallot(Map.of("choice", "A")).getStatusCode());
        verify(ballotStore, never()).cast(anyString(), any(byte[].class));
    }

    @Test
    void testReceiptLookup() {
        when(ballotStore.verifyReceipt("known"))
            .thenReturn(Result.success(new ReceiptVerification(true, "e1", "hash", 5L)));
        when(ballotStore.verifyReceipt("unknown")).thenReturn(Result.success(ReceiptVerification.notFound()));

        Map<String, Object> known = votingController.verifyReceipt("known").getBody();
        Map<String, Object> unknown = votingController.verifyReceipt("unknown").getBody();

        assertEquals(true, known.get("verified"));
        assertEquals("hash", known.get("ballotHash"));
        assertEquals(false, unknown.get("verified"));
        assertFalse(unknown.containsKey("ballotHash"));
    }
}
