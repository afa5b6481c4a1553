package com.example.securevote.grpc;

import com.example.securevote.model.AuditEntry;
import com.example.securevote.model.AuditEventType;
import com.example.securevote.model.ChainVerification;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.service.AuditLedger;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuditGrpcService.
 */
@ExtendWith(MockitoExtension.class)
class AuditGrpcServiceTest {

    @Mock
    private AuditLedger auditLedger;

    @Mock
    private StreamObserver<VerifyChainResponse> verifyObserver;

    @Mock
    private StreamObserver<GrpcAuditEntry> entryObserver;

    private AuditGrpcService auditGrpcService;

    @BeforeEach
    void setUp() {
        auditGrpcService = new AuditGrpcService(auditLedger);
    }

    @Test
    void testVerifyChainIntact() {
        when(auditLedger.inspectChain("e1")).thenReturn(Result.success(ChainVerification.intact("e1", 6, "head")));

        auditGrpcService.verifyChain(VerifyChainRequest.newBuilder().setElectionId("e1").build(), verifyObserver);

        ArgumentCaptor<VerifyChainResponse> captor = ArgumentCaptor.forClass(VerifyChainResponse.class);
        verify(verifyObserver).onNext(captor.capture());
        verify(verifyObserver).onCompleted();
        assertTrue(captor.getValue().getValid());
        assertEquals(6, captor.getValue().getEntriesChecked());
        assertEquals("head", captor.getValue().getHeadHash());
        assertEquals(0, captor.getValue().getBrokenAt());
    }

    @Test
    void testVerifyChainBroken() {
        when(auditLedger.inspectChain("e1")).thenReturn(Result.success(ChainVerification.broken("e1", 4, 3, "prefix")));

        auditGrpcService.verifyChain(VerifyChainRequest.newBuilder().setElectionId("e1").build(), verifyObserver);

        ArgumentCaptor<VerifyChainResponse> captor = ArgumentCaptor.forClass(VerifyChainResponse.class);
        verify(verifyObserver).onNext(captor.capture());
        assertFalse(captor.getValue().getValid());
        assertEquals(4, captor.getValue().getBrokenAt());
    }

    @Test
    void testVerifyChainStorageUnavailable() {
        when(auditLedger.inspectChain("e1")).thenReturn(Result.failure(VoteError.STORAGE_UNAVAILABLE));

        auditGrpcService.verifyChain(VerifyChainRequest.newBuilder().setElectionId("e1").build(), verifyObserver);

        ArgumentCaptor<Throwable> captor = ArgumentCaptor.forClass(Throwable.class);
        verify(verifyObserver).onError(captor.capture());
        verify(verifyObserver, never()).onNext(any());
        assertEquals(Status.Code.UNAVAILABLE, ((StatusRuntimeException) captor.getValue()).getStatus().getCode());
    }

    @Test
    void testVerifyChainRejectsBadElectionId() {
        auditGrpcService.verifyChain(VerifyChainRequest.newBuilder().setElectionId("").build(), verifyObserver);

        ArgumentCaptor<Throwable> captor = ArgumentCaptor.forClass(Throwable.class);
        verify(verifyObserver).onError(captor.capture());
        assertEquals(Status.Code.INVALID_ARGUMENT, ((StatusRuntimeException) captor.getValue()).getStatus().getCode());
        verifyNoInteractions(auditLedger);
    }

    @Test
    void testStreamEntries() {
        AuditEntry first = entry(1, AuditEventType.ELECTION_OPENED);
        AuditEntry second = entry(2, AuditEventType.VOTERS_IMPORTED);
        when(auditLedger.entries("e1")).thenReturn(List.of(first, second));

        auditGrpcService.streamEntries(StreamEntriesRequest.newBuilder().setElectionId("e1").build(), entryObserver);

        ArgumentCaptor<GrpcAuditEntry> captor = ArgumentCaptor.forClass(GrpcAuditEntry.class);
        verify(entryObserver, times(2)).onNext(captor.capture());
        verify(entryObserver).onCompleted();
        assertEquals(1, captor.getAllValues().get(0).getSequenceNo());
        assertEquals("VOTERS_IMPORTED", captor.getAllValues().get(1).getEventType());
        assertEquals("hash-2", captor.getAllValues().get(1).getEntryHash());
    }

    private static AuditEntry entry(long seq, AuditEventType type) {
        return AuditEntry.builder()
            .electionId("e1")
            .sequenceNo(seq)
            .eventType(type.name())
            .actorRef("test")
            .payload("{}")
            .payloadHash("payload-" + seq)
            .prevHash("prev-" + seq)
            .entryHash("hash-" + seq)
            .recordedAt(1000L + seq)
            .build();
    }
}
