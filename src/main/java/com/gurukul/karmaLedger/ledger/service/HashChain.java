package com.gurukul.karmaLedger.ledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gurukul.karmaLedger.ledger.model.ChainVerificationReport;
import com.gurukul.karmaLedger.ledger.model.LedgerEntry;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Canonical serialization and SHA-256 chaining of ledger entries.
 *
 * entry_hash = sha256_hex(canonical_json(content incl. ledgerIndex) + previousHash)
 *
 * Canonical JSON has keys sorted at every level, nulls included and no whitespace.
 * The integrity fields previousHash and entryHash are not part of the content.
 */
@Component
public class HashChain {

    /**
     * Predecessor hash of the entry at index 0.
     */
    public static final String GENESIS_HASH = "0".repeat(64);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    /**
     * Assigns index and predecessor to a draft entry and computes its hash.
     *
     * @throws IllegalArgumentException when the entry content cannot be serialized
     */
    public LedgerEntry seal(LedgerEntry draft, long ledgerIndex, String previousHash) {
        LedgerEntry indexed = draft.toBuilder()
                .ledgerIndex(ledgerIndex)
                .previousHash(previousHash)
                .entryHash(null)
                .build();
        return indexed.toBuilder()
                .entryHash(computeHash(indexed, previousHash))
                .build();
    }

    public String computeHash(LedgerEntry entry, String previousHash) {
        String canonical = canonicalJson(entry);
        return sha256Hex(canonical + (previousHash == null ? "" : previousHash));
    }

    /**
     * Canonical JSON of the hashed content of an entry.
     */
    public String canonicalJson(LedgerEntry entry) {
        Map<String, Object> content = new HashMap<>();
        content.put("timestamp", entry.getTimestamp());
        content.put("level", entry.getLevel() == null ? null : entry.getLevel().name());
        content.put("event_type", entry.getEventType() == null ? null : entry.getEventType().value());
        content.put("component", entry.getComponent());
        content.put("user_id", entry.getUserId());
        content.put("session_id", entry.getSessionId());
        content.put("request_id", entry.getRequestId());
        content.put("message", entry.getMessage());
        content.put("data", entry.getData());
        content.put("error_details", entry.getErrorDetails());
        content.put("performance_metrics", entry.getPerformanceMetrics());
        content.put("ledger_index", entry.getLedgerIndex());
        try {
            return canonicalMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger entry content is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Converts a caller payload into plain JSON types (maps, lists, strings, numbers,
     * booleans) so the retained entry hashes the same after an export round-trip.
     *
     * @return unmodifiable plain copy, or null for null input
     * @throws IllegalArgumentException when the payload cannot be serialized
     */
    public Map<String, Object> toPlainPayload(Map<String, ?> payload) {
        if (payload == null) {
            return null;
        }
        try {
            Map<String, Object> plain = canonicalMapper.readValue(canonicalMapper.writeValueAsString(payload), PAYLOAD_TYPE);
            return Collections.unmodifiableMap(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Recomputes the chain over a contiguous run of entries.
     *
     * The predecessor of the first entry is the genesis hash when its index is 0,
     * otherwise its stored previousHash. For every later entry it is the stored hash of
     * the entry before it. Checking continues past a mismatch so every tampered index
     * is reported.
     */
    public ChainVerificationReport verify(List<LedgerEntry> entries) {
        List<Long> tampered = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        if (entries == null || entries.isEmpty()) {
            return ChainVerificationReport.builder()
                    .valid(true)
                    .entriesChecked(0)
                    .firstIndex(-1)
                    .lastIndex(-1)
                    .headHash(GENESIS_HASH)
                    .tamperedIndices(List.of())
                    .issues(List.of())
                    .build();
        }

        LedgerEntry previous = null;
        for (LedgerEntry entry : entries) {
            long index = entry.getLedgerIndex();
            boolean intact = true;
            String predecessor;

            if (previous == null) {
                if (index == 0 && !GENESIS_HASH.equals(entry.getPreviousHash())) {
                    issues.add("index " + index + ": first entry does not link to the genesis hash");
                    intact = false;
                }
                predecessor = index == 0 ? GENESIS_HASH : entry.getPreviousHash();
            } else {
                if (index != previous.getLedgerIndex() + 1) {
                    issues.add("index " + index + ": expected index " + (previous.getLedgerIndex() + 1));
                    intact = false;
                }
                predecessor = previous.getEntryHash();
                if (predecessor == null || !predecessor.equals(entry.getPreviousHash())) {
                    issues.add("index " + index + ": previous hash does not match entry " + previous.getLedgerIndex());
                    intact = false;
                }
            }

            String recomputed = recompute(entry, predecessor);
            if (recomputed == null || !recomputed.equals(entry.getEntryHash())) {
                issues.add("index " + index + ": entry hash mismatch");
                intact = false;
            }

            if (!intact) {
                tampered.add(index);
            }
            previous = entry;
        }

        return ChainVerificationReport.builder()
                .valid(tampered.isEmpty())
                .entriesChecked(entries.size())
                .firstIndex(entries.get(0).getLedgerIndex())
                .lastIndex(previous.getLedgerIndex())
                .headHash(previous.getEntryHash())
                .tamperedIndices(List.copyOf(tampered))
                .issues(List.copyOf(issues))
                .build();
    }

    private String recompute(LedgerEntry entry, String predecessor) {
        try {
            return computeHash(entry, predecessor);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
