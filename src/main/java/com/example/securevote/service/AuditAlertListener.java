package com.example.securevote.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Surfaces chain breaks on the operator/auditor channel. Nothing here repairs the ledger.
 */
@Component
public class AuditAlertListener {

    private static final Logger ALERTS = LoggerFactory.getLogger("securevote.audit.alerts");

    private final Map<String, Long> brokenElections = new ConcurrentHashMap<>();

    @EventListener
    public void onChainBroken(ChainBrokenEvent event) {
        Long previous = brokenElections.put(event.getElectionId(), event.getBrokenAt());
        if (previous == null || previous != event.getBrokenAt()) {
            ALERTS.error("AUDIT CHAIN BROKEN election={} brokenAt={}; ledger untrusted from this sequence on",
                event.getElectionId(), event.getBrokenAt());
        } else {
            ALERTS.warn("Audit chain still broken election={} brokenAt={}", event.getElectionId(), event.getBrokenAt());
        }
    }

    /**
     * Elections whose last verification failed, with the reported break position.
     */
    public Map<String, Long> getBrokenElections() {
        return Map.copyOf(brokenElections);
    }
}
