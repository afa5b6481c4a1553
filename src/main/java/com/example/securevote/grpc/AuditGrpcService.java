package com.example.securevote.grpc;

import com.example.securevote.model.AuditEntry;
import com.example.securevote.model.ChainVerification;
import com.example.securevote.model.Result;
import com.example.securevote.service.AuditLedger;
import com.example.securevote.service.ElectionRegistry;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Auditor channel: chain verification and raw entry export for independent recomputation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditGrpcService extends AuditLedgerServiceGrpc.AuditLedgerServiceImplBase {

    private final AuditLedger auditLedger;

    @Override
    public void verifyChain(VerifyChainRequest request, StreamObserver<VerifyChainResponse> responseObserver) {
        if (!ElectionRegistry.isValidElectionId(request.getElectionId())) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription("Invalid election id").asRuntimeException());
            return;
        }
        try {
            Result<ChainVerification> inspected = auditLedger.inspectChain(request.getElectionId());
            if (inspected.isFailure()) {
                responseObserver.onError(Status.UNAVAILABLE.withDescription(inspected.getMessage()).asRuntimeException());
                return;
            }
            ChainVerification verification = inspected.getValue();
            VerifyChainResponse.Builder response = VerifyChainResponse.newBuilder()
                .setElectionId(verification.getElectionId())
                .setValid(verification.isValid())
                .setEntriesChecked(verification.getEntriesChecked())
                .setHeadHash(verification.getHeadHash());
            if (!verification.isValid()) {
                response.setBrokenAt(verification.getBrokenAt());
            }
            responseObserver.onNext(response.build());
            responseObserver.onCompleted();
        } catch (Exception e) {
            log.error("Error handling chain verification", e);
            responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException());
        }
    }

    @Override
    public void streamEntries(StreamEntriesRequest request, StreamObserver<GrpcAuditEntry> responseObserver) {
        if (!ElectionRegistry.isValidElectionId(request.getElectionId())) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription("Invalid election id").asRuntimeException());
            return;
        }
        try {
            List<AuditEntry> entries = auditLedger.entries(request.getElectionId());
            for (AuditEntry entry : entries) {
                responseObserver.onNext(toGrpc(entry));
            }
            responseObserver.onCompleted();
        } catch (Exception e) {
            log.error("Error streaming audit entries", e);
            responseObserver.onError(Status.UNAVAILABLE.withDescription(e.getMessage()).asRuntimeException());
        }
    }

    static GrpcAuditEntry toGrpc(AuditEntry entry) {
        return GrpcAuditEntry.newBuilder()
            .setElectionId(entry.getElectionId())
            .setSequenceNo(entry.getSequenceNo())
            .setEventType(entry.getEventType())
            .setActorRef(entry.getActorRef())
            .setPayload(entry.getPayload())
            .setPayloadHash(entry.getPayloadHash())
            .setPrevHash(entry.getPrevHash())
            .setEntryHash(entry.getEntryHash())
            .setRecordedAt(entry.getRecordedAt())
            .build();
    }
}
