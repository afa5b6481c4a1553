package com.example.securevote.controller;

import com.example.securevote.model.AuditEntry;
import com.example.securevote.model.ChainVerification;
import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import com.example.securevote.service.AuditLedger;
import com.example.securevote.service.ElectionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Auditor surface over the ledger.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditLedger auditLedger;

    /**
     * {@code {ok:true}} or {@code {ok:false, brokenAt}}. A broken chain answers 409.
     */
    @GetMapping("/{electionId}/verify")
    public ResponseEntity<Map<String, Object>> verify(@PathVariable String electionId) {
        if (!ElectionRegistry.isValidElectionId(electionId)) {
            return ApiResponses.badRequest("Invalid election id");
        }
        Result<ChainVerification> inspected = auditLedger.inspectChain(electionId);
        if (inspected.isFailure()) {
            return ApiResponses.error(inspected);
        }

        ChainVerification verification = inspected.getValue();
        Map<String, Object> response = new HashMap<>();
        response.put("electionId", electionId);
        response.put("ok", verification.isValid());
        response.put("entriesChecked", verification.getEntriesChecked());
        response.put("headHash", verification.getHeadHash());
        if (!verification.isValid()) {
            response.put("success", false);
            response.put("error", VoteError.CHAIN_BROKEN.name());
            response.put("brokenAt", verification.getBrokenAt());
            return ResponseEntity.status(VoteError.CHAIN_BROKEN.getHttpStatus()).body(response);
        }
        return ApiResponses.ok(response);
    }

    @GetMapping("/{electionId}/entries")
    public ResponseEntity<Map<String, Object>> entries(@PathVariable String electionId) {
        if (!ElectionRegistry.isValidElectionId(electionId)) {
            return ApiResponses.badRequest("Invalid election id");
        }
        try {
            List<AuditEntry> entries = auditLedger.entries(electionId);
            return ApiResponses.ok(Map.of("electionId", electionId, "count", entries.size(), "entries", entries));
        } catch (DataAccessException e) {
            return ApiResponses.error(VoteError.STORAGE_UNAVAILABLE, null);
        }
    }
}
