package com.gurukul.karmaLedger.ledger.controller;

import com.gurukul.karmaLedger.ledger.exception.InvalidLedgerQueryException;
import com.gurukul.karmaLedger.ledger.model.ChainVerificationReport;
import com.gurukul.karmaLedger.ledger.model.LedgerEntry;
import com.gurukul.karmaLedger.ledger.model.LedgerEventType;
import com.gurukul.karmaLedger.ledger.model.LedgerMetricsSnapshot;
import com.gurukul.karmaLedger.ledger.service.LedgerLogger;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only dashboard endpoints over the ledger.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerLogger ledgerLogger;

    @GetMapping("/metrics")
    public ResponseEntity<LedgerMetricsSnapshot> metrics() {
        return ResponseEntity.ok(ledgerLogger.getMetrics());
    }

    /**
     * Most recent retained entries, oldest first.
     *
     * @param userId optional user filter
     * @param eventType optional event type filter, e.g. "karma_action"
     * @param limit maximum number of entries (default 100)
     */
    @GetMapping("/audit-trail")
    public ResponseEntity<List<LedgerEntry>> auditTrail(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String eventType,
            @RequestParam(defaultValue = "" + LedgerLogger.DEFAULT_AUDIT_TRAIL_LIMIT) int limit) {
        LedgerEventType type = null;
        if (eventType != null && !eventType.isBlank()) {
            type = LedgerEventType.fromValue(eventType);
            if (type == null) {
                throw new InvalidLedgerQueryException("Unknown event type: " + eventType);
            }
        }
        return ResponseEntity.ok(ledgerLogger.getAuditTrail(userId, type, limit));
    }

    @GetMapping("/verify")
    public ResponseEntity<ChainVerificationReport> verify() {
        return ResponseEntity.ok(ledgerLogger.verifyTrail());
    }
}
