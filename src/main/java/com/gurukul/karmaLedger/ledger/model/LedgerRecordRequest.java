package com.gurukul.karmaLedger.ledger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Caller-supplied content of an entry to be recorded.
 * Level is optional and defaults from the event type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerRecordRequest {

    private LedgerEventType eventType;
    private LedgerLevel level;
    private String component;
    private String message;
    private Map<String, Object> data;
    private String userId;
    private String sessionId;
    private String requestId;
    private Map<String, Object> errorDetails;
    private Map<String, Object> performanceMetrics;
}
