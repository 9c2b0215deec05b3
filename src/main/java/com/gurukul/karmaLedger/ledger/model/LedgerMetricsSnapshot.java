package com.gurukul.karmaLedger.ledger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Point-in-time view of the ledger counters, for dashboards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerMetricsSnapshot {

    private long apiRequests;
    private long apiResponses;
    private long validationErrors;
    private long systemErrors;
    private long securityEvents;
    private long karmaActions;

    /**
     * Successful atonements only.
     */
    private long atonementCompletions;

    private long performanceMetrics;

    /**
     * Entries lost because the durable sink rejected them.
     */
    private long droppedEntries;

    /**
     * Validation errors keyed by "errorType:field".
     */
    private Map<String, Long> errorBreakdown;

    /**
     * Mean of the most recent response times, in milliseconds.
     */
    private double averageResponseTimeMs;

    private int totalAuditEntries;
    private double uptimeHours;
    private long nextLedgerIndex;
    private String chainHead;
}
