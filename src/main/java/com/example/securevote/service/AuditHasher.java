package com.example.securevote.service;

import com.example.securevote.model.AuditEntry;
import com.example.securevote.util.CryptoUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical serialisation and hashing for audit entries.
 *
 * entry_hash = SHA-256(prev_hash || canonical(entry) || sequence_no), where canonical(entry) is
 * sorted-key JSON over every stored field except the hashes themselves.
 */
public final class AuditHasher {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private AuditHasher() {
    }

    public static String canonicalPayload(Map<String, String> payload) {
        return write(new TreeMap<>(payload));
    }

    public static String payloadHash(String canonicalPayload) {
        return CryptoUtil.sha256Hex(canonicalPayload);
    }

    public static String canonicalEntry(String electionId, String eventType, String actorRef,
                                        long recordedAt, String canonicalPayload) {
        Map<String, Object> content = new TreeMap<>();
        content.put("actorRef", actorRef);
        content.put("electionId", electionId);
        content.put("eventType", eventType);
        content.put("payload", canonicalPayload);
        content.put("recordedAt", recordedAt);
        return write(content);
    }

    public static String entryHash(String prevHash, String canonicalEntry, long sequenceNo) {
        return CryptoUtil.sha256Hex(prevHash + canonicalEntry + sequenceNo);
    }

    /**
     * Recomputes the entry hash from an entry's own stored fields and the given predecessor hash.
     */
    public static String entryHash(String prevHash, AuditEntry entry) {
        String canonical = canonicalEntry(entry.getElectionId(), entry.getEventType(), entry.getActorRef(),
            entry.getRecordedAt(), entry.getPayload());
        return entryHash(prevHash, canonical, entry.getSequenceNo());
    }

    private static String write(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit content is not serialisable", e);
        }
    }
}
