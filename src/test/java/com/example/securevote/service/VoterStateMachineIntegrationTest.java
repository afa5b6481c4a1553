package com.example.securevote.service;

import com.example.securevote.model.AuditEventType;
import com.example.securevote.model.ImportedVoter;
import com.example.securevote.model.IssuedBallotToken;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.model.VoterState;
import com.example.securevote.persistence.ballot.BallotTokenRepository;
import com.example.securevote.persistence.voter.VoterRecordEntity;
import com.example.securevote.persistence.voter.VoterRecordRepository;
import com.example.securevote.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
class VoterStateMachineIntegrationTest {

    @Autowired
    private VoterStateMachine voterStateMachine;

    @Autowired
    private ElectionRegistry electionRegistry;

    @Autowired
    private VoterRegistrationService registrationService;

    @Autowired
    private AuditLedger auditLedger;

    @Autowired
    private VoterRecordRepository voterRepository;

    @Autowired
    private BallotTokenRepository ballotTokenRepository;

    @SpyBean
    private BallotTokenVault ballotTokenVault;

    private String electionId;

    @BeforeEach
    void setUp() {
        electionId = "vsm-" + UUID.randomUUID().toString().substring(0, 8);
        assertTrue(electionRegistry.open(electionId).isSuccess());
    }

    @Test
    void testAuthenticateAndIssue() {
        String identityToken = importVoters(electionId, 1, null).get(0).getIdentityToken();

        Result<IssuedBallotToken> issued = voterStateMachine.authenticateAndIssue(identityToken);

        assertTrue(issued.isSuccess());
        assertEquals(electionId, issued.getValue().getElectionId());
        assertTrue(ballotTokenRepository.findById(CryptoUtil.sha256Hex(issued.getValue().getToken())).isPresent());

        VoterRecordEntity voter = voterOf(identityToken);
        assertEquals(VoterState.VOTED, voter.getState());
        assertTrue(voter.isHasVoted());
        assertEquals(1, auditLedger.countEvents(electionId, AuditEventType.VOTER_AUTHENTICATED));
        assertEquals(1, auditLedger.countEvents(electionId, AuditEventType.BALLOT_TOKEN_ISSUED));
        assertTrue(auditLedger.verifyChain(electionId).isSuccess());
    }

    @Test
    void testSecondAttemptIsAlreadyVoted() {
        String identityToken = importVoters(electionId, 1, null).get(0).getIdentityToken();
        assertTrue(voterStateMachine.authenticateAndIssue(identityToken).isSuccess());

        assertEquals(VoteError.ALREADY_VOTED, voterStateMachine.authenticateAndIssue(identityToken).getError().get());
        assertEquals(VoteError.ALREADY_VOTED, voterStateMachine.authenticate(identityToken).getError().get());
        assertEquals(1, auditLedger.countEvents(electionId, AuditEventType.BALLOT_TOKEN_ISSUED));
    }

    @Test
    void testConcurrentIssuanceHasExactlyOneWinner() throws Exception {
        String identityToken = importVoters(electionId, 1, null).get(0).getIdentityToken();
        int attempts = 16;

        List<Result<IssuedBallotToken>> results = runConcurrently(attempts,
            () -> voterStateMachine.authenticateAndIssue(identityToken));

        long winners = results.stream().filter(Result::isSuccess).count();
        long alreadyVoted = results.stream()
            .filter(r -> r.isFailure() && r.getError().get() == VoteError.ALREADY_VOTED)
            .count();
        assertEquals(1, winners);
        assertEquals(attempts - 1, alreadyVoted);
        assertEquals(1, ballotTokenRepository.countByElectionId(electionId));
        assertEquals(1, auditLedger.countEvents(electionId, AuditEventType.BALLOT_TOKEN_ISSUED));
    }

    @Test
    void testIdentityCheckThenIssue() {
        String identityToken = importVoters(electionId, 1, null).get(0).getIdentityToken();

        assertEquals(VoterState.AUTHENTICATED, voterStateMachine.authenticate(identityToken).getValue());
        assertEquals(VoterState.AUTHENTICATED, voterStateMachine.authenticate(identityToken).getValue());
        assertTrue(voterStateMachine.authenticateAndIssue(identityToken).isSuccess());

        assertEquals(1, auditLedger.countEvents(electionId, AuditEventType.VOTER_AUTHENTICATED));
        assertEquals(VoterState.VOTED, voterOf(identityToken).getState());
    }

    @Test
    void testExpiredIdentityTokenIsRejected() throws InterruptedException {
        String identityToken = importVoters(electionId, 1, Duration.ofMillis(1)).get(0).getIdentityToken();
        Thread.sleep(20);

        assertEquals(VoteError.EXPIRED, voterStateMachine.authenticateAndIssue(identityToken).getError().get());
        assertEquals(VoterState.INVITED, voterOf(identityToken).getState());
    }

    @Test
    void testUnknownTokenIsInvalid() {
        assertEquals(VoteError.INVALID_TOKEN,
            voterStateMachine.authenticateAndIssue(CryptoUtil.newToken()).getError().get());
        assertEquals(VoteError.INVALID_TOKEN, voterStateMachine.authenticateAndIssue("").getError().get());
    }

    @Test
    void testElectionNotOpenRollsBackAuthentication() {
        String pending = "pending-" + UUID.randomUUID().toString().substring(0, 8);
        String identityToken = importVoters(pending, 1, null).get(0).getIdentityToken();

        assertEquals(VoteError.ELECTION_NOT_OPEN,
            voterStateMachine.authenticateAndIssue(identityToken).getError().get());

        assertEquals(VoterState.INVITED, voterOf(identityToken).getState());
        assertEquals(0, auditLedger.countEvents(pending, AuditEventType.VOTER_AUTHENTICATED));
        assertEquals(0, ballotTokenRepository.countByElectionId(pending));
    }

    @Test
    void testStorageFailureFailsClosedAndIsRetryable() {
        String identityToken = importVoters(electionId, 1, null).get(0).getIdentityToken();
        doThrow(new DataAccessResourceFailureException("connection lost"))
            .doCallRealMethod()
            .when(ballotTokenVault).issueBallotToken(anyString());

        Result<IssuedBallotToken> failed = voterStateMachine.authenticateAndIssue(identityToken);

        assertEquals(VoteError.STORAGE_UNAVAILABLE, failed.getError().get());
        VoterRecordEntity voter = voterOf(identityToken);
        assertEquals(VoterState.INVITED, voter.getState());
        assertFalse(voter.isHasVoted());
        assertEquals(0, auditLedger.countEvents(electionId, AuditEventType.VOTER_AUTHENTICATED));
        assertEquals(0, ballotTokenRepository.countByElectionId(electionId));

        Result<IssuedBallotToken> retried = voterStateMachine.authenticateAndIssue(identityToken);

        assertTrue(retried.isSuccess());
        assertEquals(VoterState.VOTED, voterOf(identityToken).getState());
        assertEquals(1, ballotTokenRepository.countByElectionId(electionId));
        assertTrue(auditLedger.verifyChain(electionId).isSuccess());
    }

    @Test
    void testVotersOfOneElectionDoNotContend() throws Exception {
        List<ImportedVoter> voters = importVoters(electionId, 10, null);

        List<Result<IssuedBallotToken>> results = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(5);
        try {
            List<Future<Result<IssuedBallotToken>>> futures = new ArrayList<>();
            for (ImportedVoter voter : voters) {
                futures.add(executor.submit(() -> voterStateMachine.authenticateAndIssue(voter.getIdentityToken())));
            }
            for (Future<Result<IssuedBallotToken>> future : futures) {
                results.add(future.get(60, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(results.stream().allMatch(Result::isSuccess));
        assertEquals(10, voterRepository.countByElectionIdAndHasVotedTrue(electionId));
        assertTrue(auditLedger.verifyChain(electionId).isSuccess());
    }

    private List<ImportedVoter> importVoters(String election, int count, Duration ttl) {
        Result<List<ImportedVoter>> imported = registrationService.importVoters(election, count, ttl);
        assertTrue(imported.isSuccess(), imported.toString());
        return imported.getValue();
    }

    private VoterRecordEntity voterOf(String identityToken) {
        return voterRepository.findByIdentityTokenHash(CryptoUtil.sha256Hex(identityToken)).orElseThrow();
    }

    static <T> List<T> runConcurrently(int attempts, Callable<T> call) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(60, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
