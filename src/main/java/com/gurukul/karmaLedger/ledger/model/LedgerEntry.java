package com.gurukul.karmaLedger.ledger.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One immutable, hash-chained ledger entry.
 *
 * The content fields are supplied by the caller; {@code ledgerIndex},
 * {@code previousHash} and {@code entryHash} are assigned by the ledger at write
 * time. Entries are never edited: corrections are recorded as new entries.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LedgerEntry {

    /**
     * ISO-8601 UTC instant the entry was created.
     */
    String timestamp;

    LedgerLevel level;
    LedgerEventType eventType;

    /**
     * Logical component that produced the event (api, validation, karma_engine, ...).
     * Also selects the durable channel.
     */
    String component;

    String userId;
    String sessionId;
    String requestId;
    String message;

    Map<String, Object> data;
    Map<String, Object> errorDetails;
    Map<String, Object> performanceMetrics;

    long ledgerIndex;

    /**
     * Hash of the predecessor entry, or the genesis sentinel for index 0.
     */
    String previousHash;

    /**
     * SHA-256 over the canonical content of this entry followed by {@link #previousHash}.
     */
    String entryHash;
}
